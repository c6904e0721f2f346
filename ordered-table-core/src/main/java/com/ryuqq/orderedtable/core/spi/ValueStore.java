package com.ryuqq.orderedtable.core.spi;

/**
 * Key → Value 조회 저장소 SPI.
 *
 * <p>ValueStore는 OrderedMap이 값을 보관하는 순서 무관 조회 테이블입니다.
 * 삽입 순서는 OrderTrack이 관리하므로 구현체는 어떤 순서도 보장할 필요가 없습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>평균 O(1) get / put / remove</li>
 *   <li>저장된 키 개수 보고 (OrderTrack.length와 항상 일치해야 함)</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>null 값은 저장되지 않음 (OrderedMap이 삭제 신호로 처리한 뒤 호출하지 않음)</li>
 *   <li>Thread-safe 불필요 (단일 스레드 사용 전제)</li>
 * </ul>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Ordered Table Team
 * @since 1.0.0
 */
public interface ValueStore<K, V> {

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 저장된 값, 없으면 null
     */
    V get(K key);

    /**
     * 값 저장 (기존 값 덮어쓰기).
     *
     * @param key 키
     * @param value 값 (null 불가)
     * @return 이전 값, 없었으면 null
     */
    V put(K key, V value);

    /**
     * 값 제거.
     *
     * @param key 키
     * @return 제거된 값, 없었으면 null
     */
    V remove(K key);

    /**
     * 저장된 키 개수.
     *
     * @return 키 개수
     */
    int size();

    /**
     * 모든 값 제거.
     */
    void clear();
}
