package com.ryuqq.orderedtable.core.map;

import com.ryuqq.orderedtable.core.iteration.KeySnapshot;
import com.ryuqq.orderedtable.core.iteration.OrderedTraversal;
import com.ryuqq.orderedtable.core.iteration.Pair;
import com.ryuqq.orderedtable.core.spi.ValueStore;
import com.ryuqq.orderedtable.core.store.HashValueStore;
import com.ryuqq.orderedtable.core.track.Node;
import com.ryuqq.orderedtable.core.track.NodeIndex;
import com.ryuqq.orderedtable.core.track.OrderTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * 삽입 순서를 보존하는 연관 컨테이너.
 *
 * <p>OrderedMap은 ValueStore(값 조회), OrderTrack(삽입 순서), NodeIndex(키 → 노드)를 소유하며,
 * 모든 변경을 {@link #set(Object, Object)} 한 곳에서 처리해 세 구조를 항상 일관되게 유지합니다.</p>
 *
 * <p><strong>set 정책:</strong></p>
 * <pre>
 * 기존 키 없음 + 일반 값   → Node 생성, back에 연결, 값 저장
 * 기존 키 있음 + 일반 값   → 값만 덮어쓰기 (순서 위치 불변)
 * 삭제 신호 값             → Node가 있으면 분리 및 값 제거, 없으면 무시
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>값이 있는 키마다 OrderTrack에 정확히 하나의 Node, NodeIndex가 그 Node를 가리킴</li>
 *   <li>OrderTrack의 모든 Node는 값이 있는 키 하나에 대응</li>
 *   <li>OrderTrack.length == ValueStore.size()</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OrderedMap&lt;String, Boolean&gt; map = OrderedMap.create();
 * map.set("One", true);
 * map.set("Two", true);
 * map.set("Three", true);
 * map.set("Two", true);   // 위치 변화 없음
 *
 * for (Pair&lt;String, Boolean&gt; pair : map) {
 *     System.out.println(pair.key() + " " + pair.value());
 * }
 * // One true
 * // Two true
 * // Three true
 * </pre>
 *
 * <p><strong>제약:</strong> Thread-safe 아님. 순회 도중 구조 변경(삽입/삭제)은 지원하지 않습니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Ordered Table Team
 * @since 1.0.0
 */
public class OrderedMap<K, V> implements Iterable<Pair<K, V>> {

    private static final Logger log = LoggerFactory.getLogger(OrderedMap.class);

    private final OrderedMapConfig config;
    private final ValueStore<K, V> values;
    private final OrderTrack<K> track;
    private final NodeIndex<K> index;

    /**
     * 기본 설정으로 빈 컨테이너 생성.
     */
    public OrderedMap() {
        this(new OrderedMapConfig());
    }

    /**
     * 지정 설정과 {@link HashValueStore}로 빈 컨테이너 생성.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public OrderedMap(OrderedMapConfig config) {
        this(config, new HashValueStore<>(requireConfig(config).initialCapacity()));
    }

    /**
     * 지정 설정과 ValueStore로 빈 컨테이너 생성.
     *
     * <p>OrderedMap은 전달받은 ValueStore를 복사하지 않고 단독으로 소유합니다.
     * 생성 이후 호출자가 같은 ValueStore를 직접 변경하면 OrderTrack과의 일관성이 깨집니다.</p>
     *
     * @param config 설정
     * @param values 값 저장소 (비어 있어야 함)
     * @throws IllegalArgumentException 의존성이 null이거나 values가 비어 있지 않은 경우
     */
    public OrderedMap(OrderedMapConfig config, ValueStore<K, V> values) {
        requireConfig(config);
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (values.size() != 0) {
            throw new IllegalArgumentException("values must be empty (current size: " + values.size() + ")");
        }
        this.config = config;
        this.values = values;
        this.track = new OrderTrack<>();
        this.index = new NodeIndex<>(config.initialCapacity());
    }

    /**
     * 기본 설정으로 빈 컨테이너 생성.
     *
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 새 OrderedMap 인스턴스
     */
    public static <K, V> OrderedMap<K, V> create() {
        return new OrderedMap<>();
    }

    private static OrderedMapConfig requireConfig(OrderedMapConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    /**
     * 값 저장 또는 삭제.
     *
     * <p>값이 설정된 {@link DeletionPolicy}의 삭제 신호이면 {@link #delete(Object)}와 동일하게 동작하고,
     * 아직 없는 키에 대한 삭제 신호는 아무 흔적도 남기지 않습니다.
     * 이미 있는 키를 다시 set해도 순회 순서상 위치는 바뀌지 않습니다.</p>
     *
     * @param key 키
     * @param value 값 (삭제 신호 가능)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public void set(K key, V value) {
        requireKey(key);

        if (config.deletionPolicy().isDeletionSignal(value)) {
            remove(key);
            return;
        }

        // ValueStore가 거부하면 순서 구조는 건드리지 않음
        values.put(key, value);
        if (!index.contains(key)) {
            Node<K> node = new Node<>(key);
            track.append(node);
            index.put(node);
            log.debug("Appended key {} at back (length: {})", key, track.length());
        }
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 저장된 값, 없으면 null
     * @throws IllegalArgumentException key가 null인 경우
     */
    public V get(K key) {
        requireKey(key);
        return values.get(key);
    }

    /**
     * 키 명시적 제거.
     *
     * <p>삭제 정책과 무관하게 동작하며, 없는 키이면 아무 일도 하지 않습니다.</p>
     *
     * @param key 키
     * @return 제거된 값, 없었으면 null
     * @throws IllegalArgumentException key가 null인 경우
     */
    public V delete(K key) {
        requireKey(key);
        return remove(key);
    }

    private V remove(K key) {
        Node<K> node = index.remove(key);
        if (node == null) {
            return null;
        }
        track.unlink(node);
        V removed = values.remove(key);
        log.debug("Unlinked key {} (length: {})", key, track.length());
        return removed;
    }

    /**
     * 키 존재 여부 확인.
     *
     * @param key 키
     * @return 값이 있으면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    public boolean containsKey(K key) {
        requireKey(key);
        return index.contains(key);
    }

    /**
     * 현재 키 개수 (OrderTrack.length).
     *
     * @return 키 개수
     */
    public int size() {
        return track.length();
    }

    public boolean isEmpty() {
        return track.length() == 0;
    }

    /**
     * 모든 키 제거.
     */
    public void clear() {
        int cleared = track.length();
        track.clear();
        index.clear();
        values.clear();
        log.debug("Cleared {} keys", cleared);
    }

    /**
     * 삽입 순서상 첫 번째 키.
     *
     * @return front 키, 비어 있으면 null
     */
    public K firstKey() {
        Node<K> front = track.front();
        return front != null ? front.key() : null;
    }

    /**
     * 삽입 순서상 마지막 키.
     *
     * @return back 키, 비어 있으면 null
     */
    public K lastKey() {
        Node<K> back = track.back();
        return back != null ? back.key() : null;
    }

    /**
     * 주어진 키 바로 다음 키.
     *
     * <p>NodeIndex로 키의 Node를 다시 조회하므로 ValueStore에 접근하지 않습니다.</p>
     *
     * @param key 기준 키
     * @return 다음 키, 기준 키가 back이거나 더 이상 없으면 null
     * @throws IllegalArgumentException key가 null인 경우
     */
    public K keyAfter(K key) {
        requireKey(key);
        Node<K> node = index.get(key);
        if (node == null || node.next() == null) {
            return null;
        }
        return node.next().key();
    }

    /**
     * 주어진 키 바로 앞 키.
     *
     * @param key 기준 키
     * @return 앞 키, 기준 키가 front이거나 더 이상 없으면 null
     * @throws IllegalArgumentException key가 null인 경우
     */
    public K keyBefore(K key) {
        requireKey(key);
        Node<K> node = index.get(key);
        if (node == null || node.prev() == null) {
            return null;
        }
        return node.prev().key();
    }

    /**
     * @see OrderedTraversal#keys(OrderedMap)
     */
    public KeySnapshot<K> keys() {
        return OrderedTraversal.keys(this);
    }

    /**
     * @see OrderedTraversal#pairs(OrderedMap)
     */
    public Iterable<Pair<K, V>> pairs() {
        return OrderedTraversal.pairs(this);
    }

    /**
     * @see OrderedTraversal#iterkeys(OrderedMap)
     */
    public Iterable<K> iterkeys() {
        return OrderedTraversal.iterkeys(this);
    }

    /**
     * @see OrderedTraversal#revpairs(OrderedMap)
     */
    public Iterable<Pair<K, V>> revpairs() {
        return OrderedTraversal.revpairs(this);
    }

    /**
     * @see OrderedTraversal#reviterkeys(OrderedMap)
     */
    public Iterable<K> reviterkeys() {
        return OrderedTraversal.reviterkeys(this);
    }

    /**
     * 정방향 (key, value) 순회.
     *
     * @return 삽입 순서 Iterator
     */
    @Override
    public Iterator<Pair<K, V>> iterator() {
        return pairs().iterator();
    }

    public OrderedMapConfig config() {
        return config;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Node<K> node = track.front(); node != null; node = node.next()) {
            if (node != track.front()) {
                sb.append(", ");
            }
            sb.append(node.key()).append('=').append(values.get(node.key()));
        }
        return sb.append('}').toString();
    }
}
