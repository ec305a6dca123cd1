/**
 * Frozen, index-based dependency graph.
 *
 * <p>{@link com.ryuqq.workflow.core.graph.DependencyGraph} is built once per execution from the
 * handles registered on a workflow. A successfully built graph is always a valid DAG.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.graph;
