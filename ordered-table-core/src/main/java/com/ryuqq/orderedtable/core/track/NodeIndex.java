package com.ryuqq.orderedtable.core.track;

import java.util.HashMap;
import java.util.Map;

/**
 * Key → Node 보조 인덱스.
 *
 * <p>리스트 탐색 없이 키의 Node를 O(1)로 찾아 분리(unlink)하거나
 * 순회 커서를 다음 위치로 옮길 수 있게 합니다.</p>
 *
 * <p><strong>불변식:</strong> OrderTrack에 연결된 노드마다 정확히 하나의 엔트리</p>
 *
 * @param <K> 키 타입
 * @author Ordered Table Team
 * @since 1.0.0
 */
public final class NodeIndex<K> {

    private final Map<K, Node<K>> nodes;

    /**
     * 기본 용량으로 생성.
     */
    public NodeIndex() {
        this.nodes = new HashMap<>();
    }

    /**
     * 지정 용량으로 생성.
     *
     * @param initialCapacity 초기 용량 (양수)
     * @throws IllegalArgumentException initialCapacity가 양수가 아닌 경우
     */
    public NodeIndex(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive, but was: " + initialCapacity);
        }
        this.nodes = new HashMap<>(initialCapacity);
    }

    /**
     * 노드 등록.
     *
     * @param node 등록할 노드
     * @throws IllegalArgumentException node가 null인 경우
     * @throws IllegalStateException 같은 키의 노드가 이미 등록된 경우
     */
    public void put(Node<K> node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        Node<K> existing = nodes.putIfAbsent(node.key(), node);
        if (existing != null) {
            throw new IllegalStateException("Node already indexed for key: " + node.key());
        }
    }

    /**
     * 노드 조회.
     *
     * @param key 키
     * @return 노드, 없으면 null
     */
    public Node<K> get(K key) {
        return nodes.get(key);
    }

    /**
     * 노드 제거.
     *
     * @param key 키
     * @return 제거된 노드, 없었으면 null
     */
    public Node<K> remove(K key) {
        return nodes.remove(key);
    }

    public boolean contains(K key) {
        return nodes.containsKey(key);
    }

    public int size() {
        return nodes.size();
    }

    public void clear() {
        nodes.clear();
    }
}
