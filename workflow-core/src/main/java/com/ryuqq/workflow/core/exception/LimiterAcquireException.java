package com.ryuqq.workflow.core.exception;

/**
 * Limiter 슬롯 획득 실패.
 *
 * <p>슬롯을 기다리는 동안 취소 신호가 발생했거나 대기 스레드가 인터럽트된 경우입니다.
 * 이 경우 슬롯은 소비되지 않습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class LimiterAcquireException extends WorkflowException {

    public static final String ERROR_CODE = "WF-LIMITER";

    /**
     * 생성자.
     *
     * @param message 실패 사유
     * @param cause 원인 (인터럽트 등, null 가능)
     */
    public LimiterAcquireException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
