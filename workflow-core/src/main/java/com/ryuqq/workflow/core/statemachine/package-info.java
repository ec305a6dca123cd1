/**
 * Node state machine package.
 *
 * <p>This package implements the state transition rules a graph node follows during one
 * workflow execution.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.NodeState} - Node lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.workflow.core.statemachine.StateTransition} - State transition validation and execution</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → READY (all dependencies succeeded)
 * PENDING → SKIPPED (ancestor failed, or execution cancelled)
 * READY → RUNNING (limiter slot acquired)
 * READY → SKIPPED (execution cancelled before the handler started)
 * READY → FAILED (limiter acquisition failed)
 * RUNNING → SUCCEEDED / FAILED
 *
 * Forbidden:
 * - SUCCEEDED, FAILED, SKIPPED → * (terminal states)
 * - RUNNING → SKIPPED (running handlers are never force-terminated)
 * </pre>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.statemachine;
