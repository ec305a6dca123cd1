package com.ryuqq.workflow.core.outcome;

import com.ryuqq.workflow.core.exception.WorkflowException;
import com.ryuqq.workflow.core.statemachine.NodeState;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Workflow 실행 결과.
 *
 * <p>실행은 항상 결과 저장소, 종료 상태, 오류를 함께 반환합니다.</p>
 *
 * <p><strong>불변식:</strong> {@code errorOrNull != null} ⇔ {@code status != DONE}</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionResult&lt;PageData&gt; result = workflow.execute(ctx, config, new PageData());
 * if (result.isDone()) {
 *     PageData data = result.getData();
 * } else {
 *     WorkflowException error = result.getErrorOrNull();
 *     // error.getErrorCode(): WF-HANDLER, WF-CANCELLED, ...
 * }
 * </pre>
 *
 * @param <D> 결과 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ExecutionResult<D> {

    private final D data;
    private final Status status;
    private final WorkflowException errorOrNull;
    private final List<NodeReport> nodeReports;
    private final Duration elapsed;

    private ExecutionResult(D data, Status status, WorkflowException errorOrNull,
                            List<NodeReport> nodeReports, Duration elapsed) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if ((status == Status.DONE) != (errorOrNull == null)) {
            throw new IllegalArgumentException(
                "error must be present exactly when status is not DONE (status: " + status + ", error: " + errorOrNull + ")");
        }
        this.data = data;
        this.status = status;
        this.errorOrNull = errorOrNull;
        this.nodeReports = nodeReports == null ? List.of() : List.copyOf(nodeReports);
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /**
     * 성공 결과 생성.
     *
     * @param data 결과 저장소
     * @param nodeReports 노드별 결과
     * @param elapsed 실행 시간
     * @return ExecutionResult (DONE)
     */
    public static <D> ExecutionResult<D> done(D data, List<NodeReport> nodeReports, Duration elapsed) {
        return new ExecutionResult<>(data, Status.DONE, null, nodeReports, elapsed);
    }

    /**
     * 실패 결과 생성.
     *
     * @param data 결과 저장소 (부분적으로 변경되었을 수 있음)
     * @param error 대표 오류
     * @param nodeReports 노드별 결과
     * @param elapsed 실행 시간
     * @return ExecutionResult (FAILED)
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <D> ExecutionResult<D> failed(D data, WorkflowException error,
                                                List<NodeReport> nodeReports, Duration elapsed) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null for a failed result");
        }
        return new ExecutionResult<>(data, Status.FAILED, error, nodeReports, elapsed);
    }

    public D getData() {
        return data;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isDone() {
        return status == Status.DONE;
    }

    /**
     * 대표 오류 조회.
     *
     * <p>여러 노드가 실패한 경우 나머지 오류는 {@link Throwable#getSuppressed()}로 확인할 수 있습니다.</p>
     *
     * @return 오류, DONE이면 null
     */
    public WorkflowException getErrorOrNull() {
        return errorOrNull;
    }

    public List<NodeReport> getNodeReports() {
        return nodeReports;
    }

    /**
     * 이름으로 노드 결과 조회.
     *
     * @param name 컴포넌트 이름
     * @return 일치하는 노드 결과 (이름은 중복될 수 있음)
     */
    public List<NodeReport> getNodeReports(String name) {
        return nodeReports.stream()
            .filter(report -> report.name().equals(name))
            .collect(Collectors.toList());
    }

    /**
     * 특정 상태의 노드 수 조회.
     *
     * @param state 노드 상태
     * @return 노드 수
     */
    public long countNodes(NodeState state) {
        return nodeReports.stream().filter(report -> report.state() == state).count();
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "ExecutionResult{status=" + status
            + ", nodes=" + nodeReports.size()
            + ", elapsed=" + elapsed.toMillis() + "ms"
            + (errorOrNull != null ? ", error=" + errorOrNull : "")
            + "}";
    }
}
