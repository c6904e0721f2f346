package com.ryuqq.orderedtable.core.iteration;

/**
 * 순회 시 반환되는 (key, value) 쌍 (불변 record).
 *
 * @author Ordered Table Team
 * @since 1.0.0
 * @param key 키
 * @param value 순회 시점에 ValueStore에서 조회한 값
 * @param <K> 키 타입
 * @param <V> 값 타입
 */
public record Pair<K, V>(K key, V value) {

    /**
     * Pair 생성.
     *
     * @param key 키
     * @param value 값
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return Pair 인스턴스
     */
    public static <K, V> Pair<K, V> of(K key, V value) {
        return new Pair<>(key, value);
    }
}
