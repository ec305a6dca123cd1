/**
 * Cancellation signal passed to every execution and every handler invocation.
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.context;
