package com.ryuqq.workflow.core.limiter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 획득한 Limiter 슬롯.
 *
 * <p>try-with-resources로 사용하여 모든 종료 경로에서 슬롯이 정확히 한 번 반환되도록 합니다.
 * {@link #close()}를 여러 번 호출해도 반환은 한 번만 일어납니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Permit implements AutoCloseable {

    private final ConcurrencyLimiter limiter;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Permit(ConcurrencyLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    /**
     * Limiter 구현체가 슬롯 획득 직후 호출합니다.
     *
     * @param limiter 슬롯을 발급한 Limiter
     * @return Permit 인스턴스
     * @throws IllegalArgumentException limiter가 null인 경우
     */
    public static Permit issuedBy(ConcurrencyLimiter limiter) {
        return new Permit(limiter);
    }

    /**
     * 이미 반환되었는지 확인.
     *
     * @return 반환되었으면 true
     */
    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            limiter.release();
        }
    }
}
