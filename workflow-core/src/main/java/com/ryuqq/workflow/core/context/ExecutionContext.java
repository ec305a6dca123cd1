package com.ryuqq.workflow.core.context;

import com.ryuqq.workflow.core.exception.WorkflowCancelledException;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 실행 취소 신호.
 *
 * <p>Workflow 실행과 모든 핸들러 호출에 전달되어, 블로킹 가능한 모든 지점
 * (Limiter 슬롯 대기, 핸들러 내부 I/O)에서 협조적 취소를 가능하게 합니다.</p>
 *
 * <p><strong>계층 구조:</strong></p>
 * <ul>
 *   <li>{@link #background()}: 새 루트 컨텍스트</li>
 *   <li>{@link #withCancel()}: 자식 컨텍스트 (부모 취소 시 함께 취소)</li>
 *   <li>{@link #withTimeout(Duration)}: 기한이 지나면 자동 취소되는 자식 컨텍스트</li>
 * </ul>
 *
 * <p><strong>보장:</strong> 취소는 한 번만 일어나며 되돌릴 수 없습니다.
 * 엔진은 취소 시 새 노드를 디스패치하지 않을 뿐, 실행 중인 핸들러를 강제 종료하지 않습니다.
 * 핸들러는 {@link #isCancelled()}, {@link #throwIfCancelled()}, {@link #sleep(Duration)}로
 * 직접 취소를 관찰해야 합니다.</p>
 *
 * <p>부모는 아직 취소되지 않은 자식만 참조합니다. 자식이 취소되면 부모의 자식 목록에서 제거되므로,
 * 오래 유지되는 루트 컨텍스트에서 실행을 반복해도 종료된 실행의 컨텍스트가 누적되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExecutionContext ctx = ExecutionContext.background().withTimeout(Duration.ofSeconds(30));
 * ExecutionResult<Data> result = workflow.execute(ctx, config, new Data());
 * }</pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final CompletableFuture<String> cancellation = new CompletableFuture<>();
    private final Set<ExecutionContext> children = ConcurrentHashMap.newKeySet();

    private ExecutionContext() {
    }

    /**
     * 새 루트 컨텍스트 생성.
     *
     * @return 취소되지 않은 루트 컨텍스트
     */
    public static ExecutionContext background() {
        return new ExecutionContext();
    }

    /**
     * 자식 컨텍스트 생성.
     *
     * <p>부모가 취소되면 같은 사유로 자식도 취소됩니다. 자식의 취소는 부모에 영향을 주지 않습니다.</p>
     *
     * @return 자식 컨텍스트
     */
    public ExecutionContext withCancel() {
        ExecutionContext child = new ExecutionContext();
        children.add(child);
        child.cancellation.thenRun(() -> children.remove(child));

        // add와 부모 cancel의 순회가 엇갈린 경우
        String reason = cancellation.getNow(null);
        if (reason != null) {
            child.cancel(reason);
        }
        return child;
    }

    /**
     * 기한이 있는 자식 컨텍스트 생성.
     *
     * @param timeout 기한 (양수)
     * @return timeout 경과 후 자동 취소되는 자식 컨텍스트
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public ExecutionContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        ExecutionContext child = withCancel();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .execute(() -> child.cancel(DEADLINE_EXCEEDED));
        return child;
    }

    /**
     * 취소 (기본 사유).
     */
    public void cancel() {
        cancel("cancelled by caller");
    }

    /**
     * 취소.
     *
     * <p>이미 취소된 경우 아무 동작도 하지 않으며 최초 사유가 유지됩니다.</p>
     *
     * @param reason 취소 사유
     */
    public void cancel(String reason) {
        String effective = reason == null || reason.isBlank() ? "cancelled" : reason;
        if (!cancellation.complete(effective)) {
            return;
        }
        for (ExecutionContext child : children) {
            child.cancel(effective);
        }
    }

    /**
     * 아직 취소되지 않은 자식 컨텍스트 수.
     */
    int liveChildCount() {
        return children.size();
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancellation.isDone();
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유 (취소되지 않았으면 empty)
     */
    public Optional<String> getCancellationReason() {
        return Optional.ofNullable(cancellation.getNow(null));
    }

    /**
     * 취소되었으면 예외 발생.
     *
     * @throws WorkflowCancelledException 취소된 경우
     */
    public void throwIfCancelled() throws WorkflowCancelledException {
        if (isCancelled()) {
            throw new WorkflowCancelledException(cancellation.join());
        }
    }

    /**
     * 취소 시 실행할 콜백 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param callback 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public void onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        cancellation.thenRun(callback);
    }

    /**
     * 협조적 대기.
     *
     * <p>duration 동안 대기하되, 그 사이 취소되면 즉시 {@link WorkflowCancelledException}을 던집니다.</p>
     *
     * @param duration 대기 시간
     * @throws WorkflowCancelledException 대기 중 취소되었거나 스레드가 인터럽트된 경우
     */
    public void sleep(Duration duration) throws WorkflowCancelledException {
        throwIfCancelled();
        String reason;
        try {
            reason = cancellation.get(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return; // 취소 없이 duration 경과
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowCancelledException("interrupted while sleeping");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation future completed exceptionally", e);
        }
        throw new WorkflowCancelledException(reason);
    }

    @Override
    public String toString() {
        return "ExecutionContext{cancelled=" + isCancelled()
            + getCancellationReason().map(r -> ", reason=" + r).orElse("") + "}";
    }
}
