package com.ryuqq.workflow.core.limiter.noop;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.limiter.LimiterConfig;
import com.ryuqq.workflow.core.limiter.Permit;

import java.util.Optional;

/**
 * Concurrency Limiter NoOp 구현.
 *
 * <p>동시 실행 수 제한을 적용하지 않습니다.
 * Limiter 바인딩 없이 등록된 컴포넌트에 사용되어, 스케줄러가 단일 경로로
 * 슬롯 획득/반환을 처리할 수 있게 합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 항상 즉시 Permit 반환 (취소 여부와 무관)</li>
 *   <li>tryAcquire(): 항상 Permit 반환</li>
 *   <li>release(): 아무 동작 안 함</li>
 *   <li>getCurrentConcurrency(): 항상 0 반환</li>
 *   <li>getConfig(): 무제한 설정 반환</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class NoOpConcurrencyLimiter implements ConcurrencyLimiter {

    public static final NoOpConcurrencyLimiter INSTANCE = new NoOpConcurrencyLimiter();

    private static final LimiterConfig UNLIMITED_CONFIG = LimiterConfig.of(Integer.MAX_VALUE);

    private NoOpConcurrencyLimiter() {
    }

    @Override
    public Permit acquire(ExecutionContext ctx) {
        return Permit.issuedBy(this);
    }

    @Override
    public Optional<Permit> tryAcquire() {
        return Optional.of(Permit.issuedBy(this));
    }

    @Override
    public void release() {
        // NoOp
    }

    @Override
    public int getCapacity() {
        return Integer.MAX_VALUE;
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public LimiterConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
