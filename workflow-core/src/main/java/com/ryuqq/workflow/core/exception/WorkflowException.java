package com.ryuqq.workflow.core.exception;

/**
 * Workflow 실행 오류의 최상위 타입.
 *
 * <p>Workflow는 오류를 호출자에게 던지지 않고 {@code ExecutionResult}에 담아 반환합니다.
 * 모든 하위 타입은 안정적인 오류 코드를 가집니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link ConstructionException} (WF-CONSTRUCTION): 그래프 구성 오류, 재실행</li>
 *   <li>{@link HandlerException} (WF-HANDLER): 컴포넌트 핸들러가 던진 예외</li>
 *   <li>{@link WorkflowCancelledException} (WF-CANCELLED): 실행 중 취소 신호 발생</li>
 *   <li>{@link LimiterAcquireException} (WF-LIMITER): Limiter 슬롯 대기 중 취소</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends Exception {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: WF-HANDLER)
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    protected WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
