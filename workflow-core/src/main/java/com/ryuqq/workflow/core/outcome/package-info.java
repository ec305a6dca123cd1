/**
 * Workflow execution outcome package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.outcome.Status} - Terminal outcome of one execution (DONE, FAILED)</li>
 *   <li>{@link com.ryuqq.workflow.core.outcome.NodeReport} - Per-node state and error</li>
 *   <li>{@link com.ryuqq.workflow.core.outcome.ExecutionResult} - Result store, status, error and node reports</li>
 * </ul>
 *
 * <h2>Invariant</h2>
 * <p>An execution result carries an error exactly when its status is not {@code DONE}.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.outcome;
