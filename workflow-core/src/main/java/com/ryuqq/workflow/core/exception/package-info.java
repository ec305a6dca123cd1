/**
 * Workflow error taxonomy.
 *
 * <p>All errors surfaced by a workflow execution are checked exceptions rooted at
 * {@link com.ryuqq.workflow.core.exception.WorkflowException}. They are returned inside the
 * execution result, not thrown out of {@code execute}.</p>
 *
 * <h2>Error Codes</h2>
 * <ul>
 *   <li>{@code WF-CONSTRUCTION} - {@link com.ryuqq.workflow.core.exception.ConstructionException}</li>
 *   <li>{@code WF-HANDLER} - {@link com.ryuqq.workflow.core.exception.HandlerException}</li>
 *   <li>{@code WF-CANCELLED} - {@link com.ryuqq.workflow.core.exception.WorkflowCancelledException}</li>
 *   <li>{@code WF-LIMITER} - {@link com.ryuqq.workflow.core.exception.LimiterAcquireException}</li>
 * </ul>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li><strong>Construction:</strong> aborts before any handler runs</li>
 *   <li><strong>Handler / Cancellation:</strong> independent branches already dispatched run to completion</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.exception;
