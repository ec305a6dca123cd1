package com.ryuqq.workflow.core.limiter;

/**
 * Concurrency Limiter 설정.
 *
 * <p>record를 사용하여 불변성을 보장합니다.</p>
 *
 * @param maxConcurrency 최대 동시 실행 수 (예: 50)
 * @param fair 대기자 공정성 (true: FIFO, false: best-effort)
 * @param pollIntervalMs 대기 중 취소 신호 확인 간격 (밀리초)
 * @author Workflow Team
 * @since 1.0.0
 */
public record LimiterConfig(int maxConcurrency, boolean fair, long pollIntervalMs) {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxConcurrency is less than 1
     * @throws IllegalArgumentException if pollIntervalMs is not positive
     */
    public LimiterConfig {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1 (current: " + maxConcurrency + ")");
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
    }

    /**
     * 기본 설정 (비공정, 10ms 폴링).
     *
     * @param maxConcurrency 최대 동시 실행 수
     * @return LimiterConfig 인스턴스
     */
    public static LimiterConfig of(int maxConcurrency) {
        return new LimiterConfig(maxConcurrency, false, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * fair만 변경한 새 인스턴스 생성.
     */
    public LimiterConfig withFair(boolean fair) {
        return new LimiterConfig(maxConcurrency, fair, pollIntervalMs);
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public LimiterConfig withPollIntervalMs(long pollIntervalMs) {
        return new LimiterConfig(maxConcurrency, fair, pollIntervalMs);
    }
}
