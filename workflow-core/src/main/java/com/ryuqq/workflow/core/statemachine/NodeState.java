package com.ryuqq.workflow.core.statemachine;

/**
 * 그래프 노드(컴포넌트)의 실행 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──────────────► SKIPPED (상위 노드 실패 / 취소)
 *    │                       ▲
 *    ▼ (의존성 모두 성공)      │ (취소)
 * READY ──────────────────────┤
 *    │                       │
 *    │ (Limiter 획득 실패)     │
 *    ├─► FAILED              │
 *    ▼ (슬롯 획득, 핸들러 시작)
 * RUNNING
 *    │
 *    ├─► SUCCEEDED
 *    │
 *    └─► FAILED
 *
 * 금지된 전이:
 * - 종료 상태(SUCCEEDED, FAILED, SKIPPED) → * ❌
 * - RUNNING → SKIPPED ❌ (실행 중인 핸들러는 강제 종료하지 않음)
 * - PENDING → RUNNING ❌ (READY를 거쳐야 함)
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public enum NodeState {

    /**
     * 대기 중 (해결되지 않은 의존성 있음).
     */
    PENDING,

    /**
     * 의존성 충족, Limiter 슬롯 대기 중.
     */
    READY,

    /**
     * 핸들러 실행 중.
     */
    RUNNING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 상위 노드 실패 또는 취소로 실행되지 않음.
     */
    SKIPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, FAILED, SKIPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
