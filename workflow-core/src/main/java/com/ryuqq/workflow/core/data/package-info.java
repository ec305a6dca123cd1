/**
 * Shared result store accessor.
 *
 * <p>{@link com.ryuqq.workflow.core.data.DataTracker} is the only way a component handler
 * reaches the workflow's configuration and mutable result. Handlers never receive the raw
 * result reference outside the accessor pair.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.data;
