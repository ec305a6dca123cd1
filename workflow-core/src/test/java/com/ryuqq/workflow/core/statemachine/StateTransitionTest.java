package com.ryuqq.workflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.workflow.core.statemachine.NodeState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (PENDING → READY → RUNNING → SUCCEEDED/FAILED) 성공</li>
 *   <li>미디스패치 노드의 SKIPPED 전이 성공</li>
 *   <li>종료 상태에서의 전이 시도 시 IllegalStateException</li>
 *   <li>RUNNING → SKIPPED 시도 시 IllegalStateException</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_PendingToReady_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, READY));
    }

    @Test
    void validate_ReadyToRunning_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(READY, RUNNING));
    }

    @Test
    void validate_ReadyToFailed_Succeeds() {
        // When & Then: Limiter 획득 실패
        assertDoesNotThrow(() -> StateTransition.validate(READY, FAILED));
    }

    @Test
    void validate_NormalFlowToSucceeded_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> {
            StateTransition.validate(PENDING, READY);
            StateTransition.validate(READY, RUNNING);
            StateTransition.validate(RUNNING, SUCCEEDED);
        });
        assertTrue(SUCCEEDED.isTerminal());
    }

    @Test
    void validate_RunningToFailed_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(RUNNING, FAILED));
        assertTrue(FAILED.isTerminal());
    }

    @Test
    void isAllowed_UndispatchedToSkipped() {
        // When & Then
        assertTrue(StateTransition.isAllowed(PENDING, SKIPPED));
        assertTrue(StateTransition.isAllowed(READY, SKIPPED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_RunningToSkipped_ThrowsException() {
        // When & Then: 실행 중인 핸들러는 건너뛸 수 없음
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(RUNNING, SKIPPED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_PendingToRunning_ThrowsException() {
        // When & Then: READY를 거치지 않은 실행 금지
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(PENDING, RUNNING));
    }

    @Test
    void validate_FromTerminalStates_ThrowsException() {
        for (NodeState terminal : new NodeState[]{SUCCEEDED, FAILED, SKIPPED}) {
            for (NodeState target : NodeState.values()) {
                // When & Then
                IllegalStateException exception = assertThrows(
                    IllegalStateException.class,
                    () -> StateTransition.validate(terminal, target)
                );
                assertTrue(exception.getMessage().contains("terminal state"),
                    "Expected terminal-state message for " + terminal + " → " + target);
            }
        }
    }

    @Test
    void isAllowed_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(null, READY));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(PENDING, null));
    }

    @Test
    void isTerminal_NonTerminalStates() {
        // Then
        assertFalse(PENDING.isTerminal());
        assertFalse(READY.isTerminal());
        assertFalse(RUNNING.isTerminal());
    }
}
