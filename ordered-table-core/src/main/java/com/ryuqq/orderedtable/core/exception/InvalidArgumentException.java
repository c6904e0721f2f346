package com.ryuqq.orderedtable.core.exception;

/**
 * 올바르게 생성된 OrderedMap이 아닌 값으로 순회를 요청했을 때 발생하는 예외.
 *
 * <p>호출 측의 프로그래밍 오류를 나타내며, 재시도나 내부 복구 없이
 * 호출자에게 즉시 전달됩니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>순회 진입점(keys, pairs, iterkeys, revpairs, reviterkeys)에 null 전달</li>
 * </ul>
 *
 * @author Ordered Table Team
 * @since 1.0.0
 */
public class InvalidArgumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 예외 메시지
     */
    public InvalidArgumentException(String message) {
        super(message);
    }

    /**
     * OrderedMap 자리에 null이 전달된 경우의 예외 생성.
     *
     * @return InvalidArgumentException 인스턴스
     */
    public static InvalidArgumentException nullOrderedMap() {
        return new InvalidArgumentException("Expected map of type OrderedMap, got null");
    }
}
