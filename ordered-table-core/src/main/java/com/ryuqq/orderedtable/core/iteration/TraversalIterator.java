package com.ryuqq.orderedtable.core.iteration;

import com.ryuqq.orderedtable.core.map.OrderedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

/**
 * 재조회 커서 기반 지연 Iterator.
 *
 * <p>커서 객체를 따로 두지 않고 마지막으로 반환한 키만 기억합니다.
 * 매 단계마다 그 키를 NodeIndex에서 다시 찾아 다음/이전 노드를 얻습니다.</p>
 *
 * <p><strong>순회 중 변경:</strong></p>
 * <ul>
 *   <li>마지막으로 반환한 키가 삭제되면 순회는 조기 종료 (경고 로그)</li>
 *   <li>정방향 순회 중 추가된 키가 보일 수도 있으나 보장되지 않음 (정의되지 않은 동작)</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @param <T> 반환 요소 타입 (K 또는 Pair)
 * @author Ordered Table Team
 * @since 1.0.0
 */
final class TraversalIterator<K, V, T> implements Iterator<T> {

    private static final Logger log = LoggerFactory.getLogger(TraversalIterator.class);

    private final OrderedMap<K, V> map;
    private final Direction direction;
    private final BiFunction<OrderedMap<K, V>, K, T> projection;

    private K current;
    private K pending;
    private boolean pendingResolved;
    private boolean finished;

    TraversalIterator(OrderedMap<K, V> map, Direction direction, BiFunction<OrderedMap<K, V>, K, T> projection) {
        this.map = map;
        this.direction = direction;
        this.projection = projection;
    }

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        // 미리 찾아 둔 키가 그 사이 삭제되었으면 다시 조회
        if (pendingResolved && pending != null && !map.containsKey(pending)) {
            pendingResolved = false;
        }
        if (!pendingResolved) {
            pending = current == null ? direction.start(map) : advanceFrom(current);
            pendingResolved = true;
            if (pending == null) {
                finished = true;
            }
        }
        return pending != null;
    }

    private K advanceFrom(K key) {
        K next = direction.step(map, key);
        if (next == null && !map.containsKey(key)) {
            log.warn("{} traversal halted: key {} is no longer present", direction, key);
        }
        return next;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more keys in " + direction + " traversal");
        }
        current = pending;
        pending = null;
        pendingResolved = false;
        return projection.apply(map, current);
    }
}
