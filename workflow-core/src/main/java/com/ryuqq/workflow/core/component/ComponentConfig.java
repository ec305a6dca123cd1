package com.ryuqq.workflow.core.component;

import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.limiter.noop.NoOpConcurrencyLimiter;

/**
 * 컴포넌트 등록 옵션.
 *
 * @param concurrencyLimiter 바인딩할 Limiter (null이면 제한 없음)
 * @author Workflow Team
 * @since 1.0.0
 */
public record ComponentConfig(ConcurrencyLimiter concurrencyLimiter) {

    private static final ComponentConfig DEFAULTS = new ComponentConfig(null);

    /**
     * 기본 옵션 (Limiter 없음).
     *
     * @return ComponentConfig 인스턴스
     */
    public static ComponentConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Limiter 바인딩 옵션.
     *
     * @param limiter 바인딩할 Limiter
     * @return ComponentConfig 인스턴스
     * @throws IllegalArgumentException limiter가 null인 경우
     */
    public static ComponentConfig withLimiter(ConcurrencyLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        return new ComponentConfig(limiter);
    }

    /**
     * 실제 적용될 Limiter 조회.
     *
     * @return 바인딩된 Limiter, 없으면 {@link NoOpConcurrencyLimiter#INSTANCE}
     */
    public ConcurrencyLimiter effectiveLimiter() {
        return concurrencyLimiter != null ? concurrencyLimiter : NoOpConcurrencyLimiter.INSTANCE;
    }
}
