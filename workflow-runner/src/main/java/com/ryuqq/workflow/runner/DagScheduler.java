package com.ryuqq.workflow.runner;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;
import com.ryuqq.workflow.core.exception.HandlerException;
import com.ryuqq.workflow.core.exception.LimiterAcquireException;
import com.ryuqq.workflow.core.exception.WorkflowCancelledException;
import com.ryuqq.workflow.core.exception.WorkflowException;
import com.ryuqq.workflow.core.graph.DependencyGraph;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.limiter.Permit;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.core.outcome.NodeReport;
import com.ryuqq.workflow.core.statemachine.NodeState;
import com.ryuqq.workflow.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 단일 실행의 DAG 스케줄러.
 *
 * <p>호출 스레드가 코디네이터가 되어 완료 이벤트 큐를 소비하고,
 * 디스패치된 컴포넌트는 각자 전용 스레드에서 Limiter 슬롯 획득 → 핸들러 실행 → 슬롯 반환 순으로 실행됩니다.</p>
 *
 * <p><strong>상태 소유권:</strong></p>
 * <ul>
 *   <li>코디네이터: PENDING → READY, PENDING/READY → SKIPPED, READY → FAILED, RUNNING → SUCCEEDED/FAILED</li>
 *   <li>워커: READY → RUNNING</li>
 *   <li>워커의 READY → RUNNING과 취소 시 코디네이터의 READY → SKIPPED는 CAS로 하나만 성공</li>
 * </ul>
 *
 * <p>미해결 의존 수, 오류 목록 등 나머지 상태는 코디네이터 스레드만 접근합니다.</p>
 *
 * @param <C> 설정 타입
 * @param <D> 결과 타입
 */
final class DagScheduler<C, D> {

    private static final Logger log = LoggerFactory.getLogger(DagScheduler.class);

    private final WorkflowConfig config;
    private final DependencyGraph graph;
    private final List<Registration<C, D>> registrations;
    private final ExecutionContext runContext;
    private final DataTracker<C, D> tracker;

    private final AtomicReferenceArray<NodeState> states;
    private final WorkflowException[] nodeErrors;
    private final int[] unresolved;
    private final BlockingQueue<NodeEvent> events = new LinkedBlockingQueue<>();
    private final List<WorkflowException> errors = new ArrayList<>();

    private int settled;
    private boolean cancelled;
    private String cancellationReason;
    private ExecutorService workers;

    DagScheduler(WorkflowConfig config, DependencyGraph graph, List<Registration<C, D>> registrations,
                 ExecutionContext ctx, DataTracker<C, D> tracker) {
        this.config = config;
        this.graph = graph;
        this.registrations = registrations;
        this.runContext = ctx.withCancel();
        this.tracker = tracker;

        int size = graph.size();
        this.states = new AtomicReferenceArray<>(size);
        this.nodeErrors = new WorkflowException[size];
        this.unresolved = new int[size];
        for (int node = 0; node < size; node++) {
            states.set(node, NodeState.PENDING);
            unresolved[node] = graph.dependenciesOf(node).size();
        }
    }

    /**
     * 실행 후 결과 반환.
     *
     * @param data 호출자가 전달한 결과값 (결과에 그대로 담김)
     * @param startNanos execute 진입 시각
     * @return 실행 결과
     */
    ExecutionResult<D> run(D data, long startNanos) {
        workers = Executors.newCachedThreadPool(workerThreadFactory());
        runContext.onCancel(() -> events.offer(NodeEvent.cancellation()));
        try {
            for (int root : graph.roots()) {
                dispatch(root);
            }
            awaitSettlement();
        } finally {
            workers.shutdown();
            runContext.cancel("workflow '" + config.name() + "' returned");
        }
        return buildResult(data, Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * 모든 노드가 종료될 때까지 (또는 취소될 때까지) 완료 이벤트 처리.
     */
    private void awaitSettlement() {
        int size = graph.size();
        while (settled < size) {
            NodeEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                onCancellation("interrupted while awaiting completion");
                return;
            }

            if (event.kind() == NodeEvent.Kind.ACQUIRE_FAILED) {
                onAcquireFailure(event.index(), (LimiterAcquireException) event.failure());
            } else if (event.kind() == NodeEvent.Kind.FINISHED) {
                if (event.failure() == null) {
                    onSuccess(event.index());
                } else {
                    onHandlerFailure(event.index(), event.failure());
                }
            }

            // 취소로 인한 핸들러 실패가 CANCELLED 이벤트보다 먼저 도착할 수 있음
            if (cancellationAffectsOutcome()) {
                onCancellation(runContext.getCancellationReason().orElse("cancelled"));
                if (!config.awaitRunningOnCancel()) {
                    return;
                }
            }
        }
    }

    /**
     * 취소 신호가 발생했고, 아직 종료되지 않은 노드가 있거나 오류가 기록된 경우 true.
     */
    private boolean cancellationAffectsOutcome() {
        return !cancelled && runContext.isCancelled() && (settled < graph.size() || !errors.isEmpty());
    }

    private void dispatch(int node) {
        if (cancelled || runContext.isCancelled()) {
            return;
        }
        if (!advance(node, NodeState.PENDING, NodeState.READY)) {
            return;
        }
        log.debug("Dispatching component '{}' (#{})", graph.nameOf(node), node);
        workers.execute(() -> runNode(node));
    }

    /**
     * 워커 스레드: 슬롯 획득 → 핸들러 실행 → 슬롯 반환 → 완료 이벤트.
     */
    private void runNode(int node) {
        Registration<C, D> registration = registrations.get(node);
        ConcurrencyLimiter limiter = registration.componentConfig().effectiveLimiter();

        Permit permit;
        try {
            permit = limiter.acquire(runContext);
        } catch (LimiterAcquireException e) {
            events.offer(NodeEvent.acquireFailed(node, e));
            return;
        } catch (RuntimeException e) {
            events.offer(NodeEvent.acquireFailed(node, new LimiterAcquireException("Limiter failed: " + e, e)));
            return;
        }

        Throwable failure;
        try (Permit held = permit) {
            if (runContext.isCancelled() || !advance(node, NodeState.READY, NodeState.RUNNING)) {
                // 취소로 SKIPPED 처리됨 (또는 처리될 예정): 슬롯만 반환
                return;
            }
            failure = invoke(registration);
        }
        events.offer(NodeEvent.finished(node, failure));
    }

    private Throwable invoke(Registration<C, D> registration) {
        try {
            registration.component().invoke(runContext, tracker);
            return null;
        } catch (Throwable t) {
            return t;
        }
    }

    private void onSuccess(int node) {
        advance(node, NodeState.RUNNING, NodeState.SUCCEEDED);
        settled++;
        log.debug("Component '{}' (#{}) succeeded", graph.nameOf(node), node);

        for (int dependent : graph.dependentsOf(node)) {
            if (--unresolved[dependent] == 0) {
                dispatch(dependent);
            }
        }
    }

    private void onHandlerFailure(int node, Throwable cause) {
        HandlerException error = new HandlerException(graph.nameOf(node), node, cause);
        advance(node, NodeState.RUNNING, NodeState.FAILED);
        recordFailure(node, error);
        log.warn("Component '{}' (#{}) failed", graph.nameOf(node), node, cause);
    }

    private void onAcquireFailure(int node, LimiterAcquireException error) {
        if (!advance(node, NodeState.READY, NodeState.FAILED)) {
            // 취소로 이미 SKIPPED
            return;
        }
        recordFailure(node, error);
        log.warn("Component '{}' (#{}) could not acquire a limiter slot: {}", graph.nameOf(node), node, error.getMessage());
    }

    private void recordFailure(int node, WorkflowException error) {
        nodeErrors[node] = error;
        errors.add(error);
        settled++;

        int skipped = 0;
        for (int descendant : graph.descendantsOf(node)) {
            if (advance(descendant, NodeState.PENDING, NodeState.SKIPPED)) {
                settled++;
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} descendants of '{}' (#{})", skipped, graph.nameOf(node), node);
        }
    }

    private void onCancellation(String reason) {
        if (cancelled) {
            return;
        }
        cancelled = true;
        cancellationReason = reason;

        int skipped = 0;
        int running = 0;
        for (int node = 0; node < graph.size(); node++) {
            if (advance(node, NodeState.PENDING, NodeState.SKIPPED) || advance(node, NodeState.READY, NodeState.SKIPPED)) {
                settled++;
                skipped++;
            } else if (states.get(node) == NodeState.RUNNING) {
                running++;
            }
        }
        log.warn("Workflow '{}' cancelled ({}): {} nodes skipped, {} still running",
            config.name(), reason, skipped, running);
    }

    /**
     * 검증된 상태 전이 CAS.
     *
     * @return 현재 상태가 from이었고 to로 전이되었으면 true
     */
    private boolean advance(int node, NodeState from, NodeState to) {
        StateTransition.validate(from, to);
        return states.compareAndSet(node, from, to);
    }

    private ExecutionResult<D> buildResult(D data, Duration elapsed) {
        List<NodeReport> reports = new ArrayList<>(graph.size());
        for (int node = 0; node < graph.size(); node++) {
            reports.add(new NodeReport(node, graph.nameOf(node), states.get(node), nodeErrors[node]));
        }

        if (cancelled) {
            WorkflowCancelledException error = new WorkflowCancelledException(cancellationReason);
            errors.forEach(error::addSuppressed);
            return ExecutionResult.failed(data, error, reports, elapsed);
        }
        if (!errors.isEmpty()) {
            // 동시에 여러 분기가 실패하면 어떤 오류가 먼저 도착할지는 비결정적
            WorkflowException primary = errors.get(0);
            errors.subList(1, errors.size()).forEach(primary::addSuppressed);
            return ExecutionResult.failed(data, primary, reports, elapsed);
        }
        return ExecutionResult.done(data, reports, elapsed);
    }

    private ThreadFactory workerThreadFactory() {
        String prefix = config.threadNamePrefix();
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 코디네이터로 전달되는 이벤트.
     */
    private record NodeEvent(Kind kind, int index, Throwable failure) {

        enum Kind {
            FINISHED,
            ACQUIRE_FAILED,
            CANCELLED
        }

        static NodeEvent finished(int index, Throwable failureOrNull) {
            return new NodeEvent(Kind.FINISHED, index, failureOrNull);
        }

        static NodeEvent acquireFailed(int index, LimiterAcquireException error) {
            return new NodeEvent(Kind.ACQUIRE_FAILED, index, error);
        }

        static NodeEvent cancellation() {
            return new NodeEvent(Kind.CANCELLED, -1, null);
        }
    }
}
