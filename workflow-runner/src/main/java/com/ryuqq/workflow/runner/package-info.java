/**
 * Workflow 실행 엔진 패키지.
 *
 * <p>컴포넌트 등록, 의존성 선언, DAG 스케줄링을 담당합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.runner.Workflow} - 등록/실행 진입점</li>
 *   <li>{@link com.ryuqq.workflow.runner.ComponentHandle} - 의존성 선언용 핸들</li>
 *   <li>{@link com.ryuqq.workflow.runner.WorkflowConfig} - 이름, 워커 스레드 이름, 취소 시 대기 정책</li>
 * </ul>
 *
 * <h2>스레드 모델</h2>
 *
 * <p>{@code execute}를 호출한 스레드가 코디네이터로 동작하며, 디스패치된 각 컴포넌트는
 * 실행 전용 워커 스레드에서 실행됩니다. 동시 실행 수의 상한은 컴포넌트에 바인딩된
 * {@link com.ryuqq.workflow.core.limiter.ConcurrencyLimiter}만이 결정합니다.</p>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.runner;
