package com.ryuqq.orderedtable.core.map;

/**
 * OrderedMap 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialCapacity: ValueStore와 NodeIndex 해시 테이블 초기 용량 (기본 16)</li>
 *   <li>deletionPolicy: set() 시 삭제 신호 해석 정책 (기본 NULL_DELETES)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>키 개수를 미리 알면 initialCapacity를 그에 맞춰 지정해 재해싱 감소</li>
 *   <li>Boolean 값을 저장한다면 NULL_DELETES 유지 권장</li>
 * </ul>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 * @param initialCapacity 초기 용량 (양수여야 함)
 * @param deletionPolicy 삭제 신호 정책 (null 불가)
 */
public record OrderedMapConfig(int initialCapacity, DeletionPolicy deletionPolicy) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: initialCapacity=16, deletionPolicy=NULL_DELETES</p>
     */
    public OrderedMapConfig() {
        this(16, DeletionPolicy.NULL_DELETES);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrderedMapConfig {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException(
                "initialCapacity must be positive (current: " + initialCapacity + ")"
            );
        }
        if (deletionPolicy == null) {
            throw new IllegalArgumentException("deletionPolicy cannot be null");
        }
    }

    /**
     * initialCapacity만 변경한 새 인스턴스 생성.
     *
     * @param initialCapacity 새로운 초기 용량
     * @return 새 OrderedMapConfig 인스턴스
     */
    public OrderedMapConfig withInitialCapacity(int initialCapacity) {
        return new OrderedMapConfig(initialCapacity, this.deletionPolicy);
    }

    /**
     * deletionPolicy만 변경한 새 인스턴스 생성.
     *
     * @param deletionPolicy 새로운 삭제 신호 정책
     * @return 새 OrderedMapConfig 인스턴스
     */
    public OrderedMapConfig withDeletionPolicy(DeletionPolicy deletionPolicy) {
        return new OrderedMapConfig(this.initialCapacity, deletionPolicy);
    }
}
