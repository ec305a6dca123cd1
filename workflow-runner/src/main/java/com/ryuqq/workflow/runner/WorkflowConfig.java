package com.ryuqq.workflow.runner;

/**
 * Workflow 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 로그에 표시되는 Workflow 이름 (기본 "workflow")</li>
 *   <li>threadNamePrefix: 컴포넌트 실행 스레드 이름 접두사 (기본 "workflow-worker-")</li>
 *   <li>awaitRunningOnCancel: 취소 후 실행 중인 핸들러 종료까지 대기할지 여부 (기본 false)</li>
 * </ul>
 *
 * <p>awaitRunningOnCancel=false이면 취소 즉시 반환하며, 실행 중이던 핸들러는 반환 이후에도
 * DataTracker를 통해 결과를 변경할 수 있습니다. true이면 실행 중인 핸들러가 모두 끝난 뒤 반환합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 * @param name Workflow 이름 (null/blank 불가)
 * @param threadNamePrefix 스레드 이름 접두사 (null/blank 불가)
 * @param awaitRunningOnCancel 취소 시 실행 중인 핸들러 대기 여부
 */
public record WorkflowConfig(
    String name,
    String threadNamePrefix,
    boolean awaitRunningOnCancel
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="workflow", threadNamePrefix="workflow-worker-", awaitRunningOnCancel=false</p>
     */
    public WorkflowConfig() {
        this("workflow", "workflow-worker-", false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkflowConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public WorkflowConfig withName(String name) {
        return new WorkflowConfig(name, threadNamePrefix, awaitRunningOnCancel);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkflowConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkflowConfig(name, threadNamePrefix, awaitRunningOnCancel);
    }

    /**
     * awaitRunningOnCancel만 변경한 새 인스턴스 생성.
     */
    public WorkflowConfig withAwaitRunningOnCancel(boolean awaitRunningOnCancel) {
        return new WorkflowConfig(name, threadNamePrefix, awaitRunningOnCancel);
    }
}
