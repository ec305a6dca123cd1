/**
 * Component model package.
 *
 * <p>A component is a named unit of work with a typed input and a handler. Dependency edges
 * and limiter bindings are attached when the component is registered on a workflow.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.component.Component} - Immutable graph node payload</li>
 *   <li>{@link com.ryuqq.workflow.core.component.ComponentHandler} - User-supplied work function</li>
 *   <li>{@link com.ryuqq.workflow.core.component.ComponentConfig} - Registration options (limiter binding)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.component;
