package com.ryuqq.orderedtable.core.iteration;

import com.ryuqq.orderedtable.core.exception.InvalidArgumentException;
import com.ryuqq.orderedtable.core.map.OrderedMap;

import java.util.ArrayList;
import java.util.List;

/**
 * OrderedMap 순회 진입점.
 *
 * <p><strong>순회 프로토콜:</strong></p>
 * <pre>
 * 프로토콜       반환           시작    방향    비고
 * ───────────  ────────────  ──────  ──────  ─────────────────────
 * keys         KeySnapshot   front   next    즉시 수집
 * pairs        Pair          front   next    지연, 값 조회 1회/단계
 * iterkeys     K             front   next    지연, 값 조회 없음
 * revpairs     Pair          back    prev    지연, 값 조회 1회/단계
 * reviterkeys  K             back    prev    지연, 값 조회 없음
 * </pre>
 *
 * <p>지연 프로토콜은 컨테이너 참조에 묶인 {@link Iterable}을 반환합니다 (내용 복사 없음).
 * {@code iterator()}를 호출할 때마다 처음부터 다시 순회하며,
 * 서로 다른 Iterator는 상태를 공유하지 않습니다.</p>
 *
 * <p>값이 필요 없다면 keys / iterkeys / reviterkeys가 ValueStore 조회를 생략하므로 더 빠릅니다.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
public final class OrderedTraversal {

    // Utility class - prevent instantiation
    private OrderedTraversal() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 키 목록 스냅샷.
     *
     * @param map 대상 컨테이너
     * @return front부터 back까지의 키와 개수
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K> KeySnapshot<K> keys(OrderedMap<K, ?> map) {
        requireMap(map);
        List<K> keys = new ArrayList<>(map.size());
        for (K key = map.firstKey(); key != null; key = map.keyAfter(key)) {
            keys.add(key);
        }
        return KeySnapshot.of(keys);
    }

    /**
     * 정방향 (key, value) 순회.
     *
     * @param map 대상 컨테이너
     * @return 삽입 순서 Pair 시퀀스
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K, V> Iterable<Pair<K, V>> pairs(OrderedMap<K, V> map) {
        requireMap(map);
        return () -> new TraversalIterator<K, V, Pair<K, V>>(map, Direction.FORWARD, OrderedTraversal::pairOf);
    }

    /**
     * 정방향 키 순회.
     *
     * @param map 대상 컨테이너
     * @return 삽입 순서 키 시퀀스
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K, V> Iterable<K> iterkeys(OrderedMap<K, V> map) {
        requireMap(map);
        return () -> new TraversalIterator<K, V, K>(map, Direction.FORWARD, OrderedTraversal::keyOf);
    }

    /**
     * 역방향 (key, value) 순회.
     *
     * @param map 대상 컨테이너
     * @return 삽입 역순 Pair 시퀀스
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K, V> Iterable<Pair<K, V>> revpairs(OrderedMap<K, V> map) {
        requireMap(map);
        return () -> new TraversalIterator<K, V, Pair<K, V>>(map, Direction.BACKWARD, OrderedTraversal::pairOf);
    }

    /**
     * 역방향 키 순회.
     *
     * @param map 대상 컨테이너
     * @return 삽입 역순 키 시퀀스
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K, V> Iterable<K> reviterkeys(OrderedMap<K, V> map) {
        requireMap(map);
        return () -> new TraversalIterator<K, V, K>(map, Direction.BACKWARD, OrderedTraversal::keyOf);
    }

    /**
     * 상태 없는 정방향 한 단계.
     *
     * <p>이전 키를 넘기면 그 다음 키를 돌려줍니다. 이전 키가 null이면 첫 번째 키를 돌려줍니다.</p>
     *
     * <pre>
     * for (String key = nextKey(map, null); key != null; key = nextKey(map, key)) { ... }
     * </pre>
     *
     * @param map 대상 컨테이너
     * @param previousKey 이전 키 (null이면 front 이전)
     * @return 다음 키, 끝이거나 previousKey가 더 이상 없으면 null
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K> K nextKey(OrderedMap<K, ?> map, K previousKey) {
        requireMap(map);
        return previousKey == null ? Direction.FORWARD.start(map) : Direction.FORWARD.step(map, previousKey);
    }

    /**
     * 상태 없는 역방향 한 단계.
     *
     * @param map 대상 컨테이너
     * @param key 현재 키 (null이면 back 이후)
     * @return 앞 키, 처음이거나 key가 더 이상 없으면 null
     * @throws InvalidArgumentException map이 null인 경우
     */
    public static <K> K previousKey(OrderedMap<K, ?> map, K key) {
        requireMap(map);
        return key == null ? Direction.BACKWARD.start(map) : Direction.BACKWARD.step(map, key);
    }

    private static <K, V> Pair<K, V> pairOf(OrderedMap<K, V> map, K key) {
        return Pair.of(key, map.get(key));
    }

    private static <K, V> K keyOf(OrderedMap<K, V> map, K key) {
        return key;
    }

    private static void requireMap(OrderedMap<?, ?> map) {
        if (map == null) {
            throw InvalidArgumentException.nullOrderedMap();
        }
    }
}
