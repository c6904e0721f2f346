package com.ryuqq.orderedtable.core.iteration;

import java.util.List;

/**
 * 호출 시점의 키 목록 스냅샷 (불변 record).
 *
 * <p>{@link OrderedTraversal#keys} 호출 시 front부터 끝까지 즉시 수집되며,
 * 이후 컨테이너가 변경되어도 스냅샷은 바뀌지 않습니다.</p>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 * @param keys 삽입 순서 키 목록 (수정 불가)
 * @param length 키 개수 (keys.size()와 동일)
 * @param <K> 키 타입
 */
public record KeySnapshot<K>(List<K> keys, int length) {

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException keys가 null이거나 length가 keys 크기와 다른 경우
     */
    public KeySnapshot {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (length != keys.size()) {
            throw new IllegalArgumentException(
                "length must equal keys size (length: " + length + ", size: " + keys.size() + ")"
            );
        }
        keys = List.copyOf(keys);
    }

    /**
     * 키 목록으로 스냅샷 생성.
     *
     * @param keys 삽입 순서 키 목록
     * @param <K> 키 타입
     * @return KeySnapshot 인스턴스
     */
    public static <K> KeySnapshot<K> of(List<K> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        return new KeySnapshot<>(keys, keys.size());
    }

    /**
     * 위치로 키 조회.
     *
     * @param position 0부터 시작하는 위치
     * @return 키
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public K get(int position) {
        return keys.get(position);
    }

    public boolean isEmpty() {
        return length == 0;
    }
}
