package com.ryuqq.workflow.runner;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.component.ComponentConfig;
import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;
import com.ryuqq.workflow.core.exception.ConstructionException;
import com.ryuqq.workflow.core.graph.DependencyGraph;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.core.outcome.NodeReport;
import com.ryuqq.workflow.core.statemachine.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * DAG Workflow.
 *
 * <p>컴포넌트를 등록하고 의존성을 연결한 뒤 {@link #execute}로 한 번 실행합니다.
 * 실행은 의존성이 모두 성공한 컴포넌트를 즉시 병렬로 디스패치하며,
 * 모든 노드가 종료 상태에 도달하거나 취소 신호가 발생할 때까지 블로킹합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * addComponent() × N → ComponentHandle
 *   ↓
 * handle.addDependencies(...)
 *   ↓
 * execute(ctx, config, data)
 *   1. 그래프 고정 및 검증 (실패 시 핸들러 호출 없이 FAILED)
 *   2. 루트 노드 디스패치
 *   3. 노드 성공 시 하위 노드의 미해결 의존 수 감소 → 0이면 디스패치
 *   4. 노드 실패 시 전이적 하위 노드 SKIPPED
 *   5. ExecutionResult(data, status, error) 반환
 * </pre>
 *
 * <p><strong>재실행:</strong> 한 인스턴스는 한 번만 실행됩니다.
 * 두 번째 호출은 핸들러를 실행하지 않고 {@link ConstructionException}과 함께 FAILED를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Workflow<PageConfig, PageData> workflow = new Workflow<>();
 *
 * ComponentHandle visual = workflow.addComponent(Component.of("VisualInformation", visualHandler));
 * ComponentHandle text = workflow.addComponent(Component.of("TextExtractor", textHandler));
 * workflow.addComponent(Component.of("Parameter1", parameterHandler))
 *     .addDependencies(visual, text);
 *
 * ExecutionResult<PageData> result = workflow.execute(ctx, new PageConfig(page), new PageData());
 * }</pre>
 *
 * @param <C> 설정 타입
 * @param <D> 결과 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Workflow<C, D> {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final WorkflowConfig config;
    private final UnaryOperator<D> snapshot;
    private final List<Registration<C, D>> registrations = new ArrayList<>();
    private boolean executed;

    /**
     * 생성자 (기본 설정).
     */
    public Workflow() {
        this(new WorkflowConfig());
    }

    /**
     * 생성자.
     *
     * @param config Workflow 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Workflow(WorkflowConfig config) {
        this(config, null);
    }

    /**
     * 생성자.
     *
     * <p>snapshot이 주어지면 핸들러가 {@link DataTracker#getData()}로 결과값 복사본을 조회할 수 있습니다.
     * 없으면 핸들러의 읽기는 {@link DataTracker#read}로만 가능합니다.</p>
     *
     * @param config Workflow 설정
     * @param snapshot 결과값 복사 함수 (null 허용)
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Workflow(WorkflowConfig config, UnaryOperator<D> snapshot) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.snapshot = snapshot;
    }

    /**
     * 컴포넌트 등록 (Limiter 없음).
     *
     * @param component 컴포넌트
     * @return 의존성 선언용 핸들
     * @throws IllegalArgumentException component가 null인 경우
     * @throws IllegalStateException 이미 실행된 경우
     */
    public ComponentHandle addComponent(Component<C, D, ?> component) {
        return addComponent(component, ComponentConfig.defaults());
    }

    /**
     * 컴포넌트 등록.
     *
     * <p>등록 순서는 실행 순서와 무관합니다.</p>
     *
     * @param component 컴포넌트
     * @param componentConfig 등록 옵션 (Limiter 바인딩 등)
     * @return 의존성 선언용 핸들
     * @throws IllegalArgumentException component 또는 componentConfig가 null인 경우
     * @throws IllegalStateException 이미 실행된 경우
     */
    public synchronized ComponentHandle addComponent(Component<C, D, ?> component, ComponentConfig componentConfig) {
        if (component == null) {
            throw new IllegalArgumentException("component cannot be null");
        }
        if (componentConfig == null) {
            throw new IllegalArgumentException("componentConfig cannot be null");
        }
        checkMutable();

        ComponentHandle handle = new ComponentHandle(this, registrations.size(), component.getName());
        registrations.add(new Registration<>(handle, component, componentConfig));
        return handle;
    }

    /**
     * 의존성 간선 추가 ({@link ComponentHandle#addDependencies}에서 호출).
     */
    synchronized void appendDependencies(ComponentHandle handle, ComponentHandle[] others) {
        checkMutable();
        handle.dependenciesView().addAll(Arrays.asList(others));
    }

    private void checkMutable() {
        if (executed) {
            throw new IllegalStateException("Workflow '" + config.name() + "' has already been executed; the graph is frozen");
        }
    }

    /**
     * Workflow 실행.
     *
     * <p>모든 노드가 종료 상태에 도달하거나 ctx가 취소될 때까지 호출 스레드를 블로킹합니다.
     * 예외를 던지지 않고 모든 오류를 결과에 담아 반환합니다.</p>
     *
     * @param ctx 취소 신호 (모든 핸들러에 전달됨)
     * @param config 읽기 전용 설정값 (null 허용)
     * @param data 결과 저장소 (컴포넌트는 DataTracker를 통해서만 접근)
     * @return 실행 결과 (error != null ⇔ status != DONE)
     * @throws IllegalArgumentException ctx 또는 data가 null인 경우
     */
    public ExecutionResult<D> execute(ExecutionContext ctx, C config, D data) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        long startNanos = System.nanoTime();

        List<Registration<C, D>> frozen;
        synchronized (this) {
            frozen = List.copyOf(registrations);
            if (executed) {
                ConstructionException error = new ConstructionException(
                    "Workflow '" + this.config.name() + "' has already been executed");
                log.warn("Rejected re-execution of workflow '{}'", this.config.name());
                return ExecutionResult.failed(data, error, skippedReports(frozen), elapsedSince(startNanos));
            }
            executed = true;
        }

        DependencyGraph graph;
        try {
            graph = freeze(frozen);
        } catch (ConstructionException e) {
            log.warn("Workflow '{}' rejected before execution: {}", this.config.name(), e.getMessage());
            return ExecutionResult.failed(data, e, skippedReports(frozen), elapsedSince(startNanos));
        }

        log.info("Workflow '{}' started: {} components, {} roots",
            this.config.name(), graph.size(), graph.roots().size());

        DataTracker<C, D> tracker = new DataTracker<>(config, data, snapshot);
        ExecutionResult<D> result = new DagScheduler<>(this.config, graph, frozen, ctx, tracker).run(data, startNanos);

        log.info("Workflow '{}' finished: status={}, elapsed={}ms",
            this.config.name(), result.getStatus(), result.getElapsed().toMillis());
        return result;
    }

    /**
     * 핸들 그래프를 인덱스 기반 그래프로 고정.
     *
     * @throws ConstructionException 다른 Workflow 또는 등록되지 않은 컴포넌트 참조, 순환
     */
    private DependencyGraph freeze(List<Registration<C, D>> frozen) throws ConstructionException {
        List<String> names = new ArrayList<>(frozen.size());
        List<Set<Integer>> dependencies = new ArrayList<>(frozen.size());

        for (Registration<C, D> registration : frozen) {
            ComponentHandle handle = registration.handle();
            Set<Integer> indices = new LinkedHashSet<>();
            for (ComponentHandle dependency : handle.dependenciesView()) {
                if (dependency.getOwner() != this) {
                    throw new ConstructionException(String.format(
                        "Component '%s' (#%d) depends on '%s' which belongs to a different workflow",
                        handle.getName(), handle.getIndex(), dependency.getName()));
                }
                int index = dependency.getIndex();
                if (index >= frozen.size() || frozen.get(index).handle() != dependency) {
                    throw new ConstructionException(String.format(
                        "Component '%s' (#%d) depends on unregistered component '%s'",
                        handle.getName(), handle.getIndex(), dependency.getName()));
                }
                indices.add(index);
            }
            names.add(handle.getName());
            dependencies.add(indices);
        }
        return DependencyGraph.of(names, dependencies);
    }

    private static <C, D> List<NodeReport> skippedReports(List<Registration<C, D>> frozen) {
        List<NodeReport> reports = new ArrayList<>(frozen.size());
        for (Registration<C, D> registration : frozen) {
            ComponentHandle handle = registration.handle();
            reports.add(new NodeReport(handle.getIndex(), handle.getName(), NodeState.SKIPPED, null));
        }
        return reports;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * 등록된 컴포넌트 수 조회.
     *
     * @return 컴포넌트 수
     */
    public synchronized int size() {
        return registrations.size();
    }

    public synchronized boolean isExecuted() {
        return executed;
    }

    public WorkflowConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "Workflow{name='" + config.name() + "', components=" + size() + "}";
    }
}
