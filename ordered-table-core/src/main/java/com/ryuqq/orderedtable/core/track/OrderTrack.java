package com.ryuqq.orderedtable.core.track;

/**
 * 삽입 순서를 기록하는 이중 연결 리스트.
 *
 * <p>OrderTrack은 front, back, length만 관리하며 키 조회는 하지 않습니다.
 * 키로 노드를 찾는 일은 {@link NodeIndex}가 담당합니다.</p>
 *
 * <p><strong>연산:</strong></p>
 * <ul>
 *   <li>append(node): O(1), back 뒤에 연결</li>
 *   <li>unlink(node): O(1), 탐색 없이 위치와 무관하게 분리</li>
 * </ul>
 *
 * <p><strong>구조 예시:</strong></p>
 * <pre>
 * front                         back
 *   │                             │
 *   ▼                             ▼
 * [One] ⇄ [Two] ⇄ [Three]
 *
 * unlink(Two):
 * [One] ⇄ [Three]
 * </pre>
 *
 * @param <K> 키 타입
 * @author Ordered Table Team
 * @since 1.0.0
 */
public final class OrderTrack<K> {

    private Node<K> front;
    private Node<K> back;
    private int length;

    /**
     * 노드를 back 뒤에 연결.
     *
     * <p>리스트가 비어 있으면 front와 back 모두 이 노드가 됩니다.</p>
     *
     * @param node 연결할 노드 (다른 리스트에 연결되지 않은 상태)
     * @throws IllegalArgumentException node가 null인 경우
     * @throws IllegalStateException node가 이미 연결된 경우
     */
    public void append(Node<K> node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (node.prev != null || node.next != null || node == front) {
            throw new IllegalStateException("Node is already linked: " + node);
        }

        node.prev = back;
        if (back != null) {
            back.next = node;
        } else {
            front = node;
        }
        back = node;
        length++;
    }

    /**
     * 노드 분리.
     *
     * <p>이웃 노드를 서로 연결하고, 분리 대상이 front/back이면 갱신합니다.
     * 분리된 노드의 링크는 비워집니다.</p>
     *
     * @param node 분리할 노드 (이 리스트에 연결된 상태)
     * @throws IllegalArgumentException node가 null인 경우
     */
    public void unlink(Node<K> node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }

        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            // front 분리
            front = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            // back 분리
            back = node.prev;
        }
        node.prev = null;
        node.next = null;
        length--;
    }

    /**
     * 모든 노드 분리.
     *
     * <p>각 노드의 링크도 비워 분리된 노드가 서로를 붙잡지 않도록 합니다.</p>
     */
    public void clear() {
        Node<K> current = front;
        while (current != null) {
            Node<K> next = current.next;
            current.prev = null;
            current.next = null;
            current = next;
        }
        front = null;
        back = null;
        length = 0;
    }

    public Node<K> front() {
        return front;
    }

    public Node<K> back() {
        return back;
    }

    public int length() {
        return length;
    }
}
