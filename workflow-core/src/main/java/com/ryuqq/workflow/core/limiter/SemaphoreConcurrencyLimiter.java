package com.ryuqq.workflow.core.limiter;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.exception.LimiterAcquireException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Semaphore 기반 Concurrency Limiter.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): pollIntervalMs 단위로 {@link Semaphore#tryAcquire(long, TimeUnit)}를 반복하며
 *       매 반복마다 취소 신호를 확인</li>
 *   <li>슬롯이 반환되면 대기자는 폴링 간격과 무관하게 즉시 깨어남</li>
 *   <li>release(): 획득 카운터를 먼저 감소시킨 뒤 세마포어 반환 (과다 반환 방지)</li>
 * </ul>
 *
 * <p>공정성은 {@link LimiterConfig#fair()}를 따르며, 기본값은 best-effort입니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class SemaphoreConcurrencyLimiter implements ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(SemaphoreConcurrencyLimiter.class);

    private final LimiterConfig config;
    private final Semaphore semaphore;
    private final AtomicInteger inUse = new AtomicInteger(0);

    /**
     * 생성자.
     *
     * @param config Limiter 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public SemaphoreConcurrencyLimiter(LimiterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.semaphore = new Semaphore(config.maxConcurrency(), config.fair());
    }

    @Override
    public Permit acquire(ExecutionContext ctx) throws LimiterAcquireException {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        try {
            while (!ctx.isCancelled()) {
                if (semaphore.tryAcquire(config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    if (ctx.isCancelled()) {
                        // 획득과 취소가 겹친 경우: 슬롯을 돌려주고 취소로 처리
                        semaphore.release();
                        break;
                    }
                    inUse.incrementAndGet();
                    return Permit.issuedBy(this);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LimiterAcquireException("Interrupted while waiting for a limiter slot", e);
        }
        String reason = ctx.getCancellationReason().orElse("cancelled");
        log.debug("Limiter acquire aborted ({} of {} slots in use): {}", inUse.get(), config.maxConcurrency(), reason);
        throw new LimiterAcquireException("Cancelled while waiting for a limiter slot: " + reason, null);
    }

    @Override
    public Optional<Permit> tryAcquire() {
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        inUse.incrementAndGet();
        return Optional.of(Permit.issuedBy(this));
    }

    @Override
    public void release() {
        int previous = inUse.getAndUpdate(current -> current > 0 ? current - 1 : current);
        if (previous <= 0) {
            throw new IllegalStateException("release() called without a matching acquire");
        }
        semaphore.release();
    }

    @Override
    public int getCapacity() {
        return config.maxConcurrency();
    }

    @Override
    public int getCurrentConcurrency() {
        return inUse.get();
    }

    @Override
    public LimiterConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "SemaphoreConcurrencyLimiter{inUse=" + inUse.get() + "/" + config.maxConcurrency() + "}";
    }
}
