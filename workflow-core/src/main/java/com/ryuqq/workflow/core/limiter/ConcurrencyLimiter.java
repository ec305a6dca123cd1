package com.ryuqq.workflow.core.limiter;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.exception.LimiterAcquireException;

import java.util.Optional;

/**
 * Concurrency Limiter SPI.
 *
 * <p>이 Limiter에 바인딩된 핸들러의 동시 실행 수를 제한하는 카운팅 세마포어입니다.
 * 하나의 인스턴스를 여러 컴포넌트, 여러 Workflow (중첩 하위 Workflow 포함)가 공유하면
 * 합쳐진 fan-out 전체에 단일 상한이 적용됩니다.</p>
 *
 * <p><strong>불변식:</strong> 어느 순간에도 같은 인스턴스로 실행 중인 핸들러 수 ≤ capacity</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ConcurrencyLimiter limiter = ConcurrencyLimiter.of(50);
 *
 * try (Permit permit = limiter.acquire(ctx)) {
 *     // 작업 실행
 *     analyzePage(page);
 * } // 예외가 발생해도 슬롯 반환
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public interface ConcurrencyLimiter {

    /**
     * 세마포어 기반 Limiter 생성.
     *
     * @param maxConcurrency 최대 동시 실행 수 (1 이상)
     * @return 새 Limiter
     * @throws IllegalArgumentException maxConcurrency가 1 미만인 경우
     */
    static ConcurrencyLimiter of(int maxConcurrency) {
        return new SemaphoreConcurrencyLimiter(LimiterConfig.of(maxConcurrency));
    }

    /**
     * 설정 기반 Limiter 생성.
     *
     * @param config Limiter 설정
     * @return 새 Limiter
     * @throws IllegalArgumentException config가 null인 경우
     */
    static ConcurrencyLimiter of(LimiterConfig config) {
        return new SemaphoreConcurrencyLimiter(config);
    }

    /**
     * 슬롯 획득 (블로킹).
     *
     * <p>슬롯이 비거나 ctx가 취소될 때까지 호출 스레드를 블로킹합니다.
     * 취소된 경우 슬롯을 소비하지 않고 예외를 던집니다.</p>
     *
     * @param ctx 취소 신호
     * @return 반환 시 슬롯을 해제하는 Permit
     * @throws LimiterAcquireException 대기 중 취소 또는 인터럽트 발생
     */
    Permit acquire(ExecutionContext ctx) throws LimiterAcquireException;

    /**
     * 슬롯 획득 시도 (비블로킹).
     *
     * @return 획득 성공 시 Permit, 슬롯이 없으면 empty
     */
    Optional<Permit> tryAcquire();

    /**
     * 슬롯 반환.
     *
     * <p>성공한 acquire 한 번당 정확히 한 번 호출되어야 합니다.
     * 일반적으로 {@link Permit#close()}를 통해 호출됩니다.</p>
     *
     * @throws IllegalStateException 획득한 슬롯보다 많이 반환하려는 경우
     */
    void release();

    /**
     * 최대 동시 실행 수 조회.
     *
     * @return capacity
     */
    int getCapacity();

    /**
     * 현재 사용 중인 슬롯 수 조회.
     *
     * @return 현재 동시 실행 수
     */
    int getCurrentConcurrency();

    /**
     * Limiter 설정 조회.
     *
     * @return Limiter 설정
     */
    LimiterConfig getConfig();
}
