package com.ryuqq.workflow.core.outcome;

import com.ryuqq.workflow.core.exception.WorkflowException;
import com.ryuqq.workflow.core.statemachine.NodeState;

/**
 * 노드별 실행 결과.
 *
 * <p>취소 후 즉시 반환된 경우, 아직 실행 중이던 노드는 RUNNING 상태로 보고됩니다.</p>
 *
 * @param index 그래프 내 인덱스 (등록 순서)
 * @param name 컴포넌트 이름
 * @param state 반환 시점의 상태
 * @param error 실패 원인 (FAILED가 아니면 null)
 * @author Workflow Team
 * @since 1.0.0
 */
public record NodeReport(
    int index,
    String name,
    NodeState state,
    WorkflowException error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state가 null이거나 FAILED인데 error가 없는 경우
     */
    public NodeReport {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == NodeState.FAILED && error == null) {
            throw new IllegalArgumentException("error is required for a FAILED node (" + name + ")");
        }
    }
}
