package com.ryuqq.orderedtable.core.track;

/**
 * 삽입 순서상의 키 위치.
 *
 * <p>Node는 OrderTrack이 소유하며, prev/next 링크는 순회와 O(1) 분리를 위한
 * 비소유 참조입니다.</p>
 *
 * <p><strong>불변성:</strong> key는 생성 후 변경 불가</p>
 * <p><strong>링크:</strong></p>
 * <ul>
 *   <li>prev: 앞 노드, front이면 null</li>
 *   <li>next: 뒤 노드, back이면 null</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @author Ordered Table Team
 * @since 1.0.0
 */
public final class Node<K> {

    private final K key;
    Node<K> prev;
    Node<K> next;

    /**
     * 생성자.
     *
     * @param key 키
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Node(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.key = key;
    }

    /**
     * 키 조회.
     *
     * @return 키
     */
    public K key() {
        return key;
    }

    /**
     * 앞 노드 조회.
     *
     * @return 앞 노드, front이면 null
     */
    public Node<K> prev() {
        return prev;
    }

    /**
     * 뒤 노드 조회.
     *
     * @return 뒤 노드, back이면 null
     */
    public Node<K> next() {
        return next;
    }

    @Override
    public String toString() {
        return "Node{" + key + '}';
    }
}
