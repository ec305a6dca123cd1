package com.ryuqq.workflow.core.outcome;

/**
 * Workflow 실행의 최종 결과 상태.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum Status {

    /**
     * 모든 노드 성공.
     */
    DONE,

    /**
     * 하나 이상의 노드 실패, 그래프 구성 오류, 또는 실행 취소.
     */
    FAILED
}
