package com.ryuqq.workflow.core.statemachine;

/**
 * 노드 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → READY, PENDING → SKIPPED</li>
 *   <li>READY → RUNNING, READY → SKIPPED, READY → FAILED</li>
 *   <li>RUNNING → SUCCEEDED, RUNNING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(SUCCEEDED, FAILED, SKIPPED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → READY)</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(NodeState from, NodeState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == NodeState.READY || to == NodeState.SKIPPED;
            case READY -> to == NodeState.RUNNING || to == NodeState.SKIPPED || to == NodeState.FAILED;
            case RUNNING -> to == NodeState.SUCCEEDED || to == NodeState.FAILED;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link IllegalStateException}을 발생시킵니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(NodeState from, NodeState to) {
        if (isAllowed(from, to)) {
            return;
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        throw new IllegalStateException(
            String.format("Invalid state transition: %s → %s", from, to)
        );
    }
}
