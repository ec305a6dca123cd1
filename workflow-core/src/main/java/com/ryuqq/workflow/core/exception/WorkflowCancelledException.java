package com.ryuqq.workflow.core.exception;

/**
 * 취소 신호로 인한 실행 중단.
 *
 * <p>Workflow 실행 전체의 취소 신호가 모든 노드가 종료 상태에 도달하기 전에
 * 발생했음을 나타냅니다. 핸들러가 {@code ExecutionContext#throwIfCancelled()}로
 * 직접 던질 수도 있습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class WorkflowCancelledException extends WorkflowException {

    public static final String ERROR_CODE = "WF-CANCELLED";

    /**
     * 생성자.
     *
     * @param reason 취소 사유
     */
    public WorkflowCancelledException(String reason) {
        super(ERROR_CODE, "Execution cancelled: " + reason, null);
    }
}
