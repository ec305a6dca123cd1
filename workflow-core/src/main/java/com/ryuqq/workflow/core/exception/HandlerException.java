package com.ryuqq.workflow.core.exception;

/**
 * 컴포넌트 핸들러 실패.
 *
 * <p>핸들러가 던진 예외를 원인(cause)으로 감싸며, 실패한 컴포넌트의 이름과
 * 그래프 내 인덱스를 함께 기록합니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class HandlerException extends WorkflowException {

    public static final String ERROR_CODE = "WF-HANDLER";

    private final String componentName;
    private final int componentIndex;

    /**
     * 생성자.
     *
     * @param componentName 실패한 컴포넌트 이름
     * @param componentIndex 실패한 컴포넌트 인덱스
     * @param cause 핸들러가 던진 예외
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public HandlerException(String componentName, int componentIndex, Throwable cause) {
        super(ERROR_CODE, buildMessage(componentName, componentIndex, cause), cause);
        this.componentName = componentName;
        this.componentIndex = componentIndex;
    }

    private static String buildMessage(String componentName, int componentIndex, Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return String.format("Component '%s' (#%d) failed: %s", componentName, componentIndex, cause);
    }

    public String getComponentName() {
        return componentName;
    }

    public int getComponentIndex() {
        return componentIndex;
    }
}
