/**
 * Concurrency Limiter SPI 패키지.
 *
 * <p>핸들러의 동시 실행 수를 제한하는 카운팅 세마포어를 정의합니다.
 * 하나의 Limiter 인스턴스는 여러 컴포넌트와 여러 Workflow 인스턴스가 공유할 수 있으며,
 * 이 경우 중첩된 하위 Workflow까지 포함한 전체 fan-out에 단일 상한이 적용됩니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workflow.core.limiter.ConcurrencyLimiter} - SPI</li>
 *   <li>{@link com.ryuqq.workflow.core.limiter.SemaphoreConcurrencyLimiter} - Semaphore 기반 기본 구현</li>
 *   <li>{@link com.ryuqq.workflow.core.limiter.Permit} - 스코프 기반 슬롯 (try-with-resources)</li>
 *   <li>{@link com.ryuqq.workflow.core.limiter.LimiterConfig} - 불변 설정 record</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.workflow.core.limiter.noop.NoOpConcurrencyLimiter}는
 * 제한 없이 항상 슬롯을 허용하며, Limiter가 지정되지 않은 컴포넌트의 기본값으로 사용됩니다.</p>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * // 문서 단위 전역 상한: 페이지 분석 최대 50개 동시 실행
 * ConcurrencyLimiter pageLimiter = ConcurrencyLimiter.of(50);
 *
 * documentWorkflow.addComponent(pageComponent, ComponentConfig.withLimiter(pageLimiter));
 * }</pre>
 *
 * @since 1.0.0
 * @author Workflow Team
 */
package com.ryuqq.workflow.core.limiter;
