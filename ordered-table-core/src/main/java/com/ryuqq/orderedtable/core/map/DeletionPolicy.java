package com.ryuqq.orderedtable.core.map;

/**
 * set() 호출 시 어떤 값을 삭제 신호로 해석할지 결정하는 정책.
 *
 * <p>삭제 신호로 해석된 값은 저장되지 않고, 해당 키를 제거합니다.
 * 명시적 제거가 필요하면 정책과 무관하게 {@link OrderedMap#delete(Object)}를 사용합니다.</p>
 *
 * <p><strong>정책 비교:</strong></p>
 * <pre>
 * 값             NULL_DELETES   FALSY_DELETES
 * ─────────────  ─────────────  ─────────────
 * null           삭제            삭제
 * Boolean.FALSE  저장            삭제
 * 그 외           저장            저장
 * </pre>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
public enum DeletionPolicy {

    /**
     * null만 삭제 신호 (기본값).
     */
    NULL_DELETES {
        @Override
        public boolean isDeletionSignal(Object value) {
            return value == null;
        }
    },

    /**
     * null과 Boolean.FALSE 모두 삭제 신호.
     *
     * <p>false 값을 저장할 수 없으므로 Boolean 값을 다루는 테이블에서는 주의가 필요합니다.</p>
     */
    FALSY_DELETES {
        @Override
        public boolean isDeletionSignal(Object value) {
            return value == null || Boolean.FALSE.equals(value);
        }
    };

    /**
     * 값이 삭제 신호인지 확인.
     *
     * @param value 검사할 값 (null 가능)
     * @return 삭제 신호이면 true
     */
    public abstract boolean isDeletionSignal(Object value);
}
