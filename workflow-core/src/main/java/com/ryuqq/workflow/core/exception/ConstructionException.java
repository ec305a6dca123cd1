package com.ryuqq.workflow.core.exception;

/**
 * 그래프 구성 오류.
 *
 * <p>순환 의존성, 등록되지 않은 컴포넌트 참조, 다른 Workflow의 컴포넌트 참조,
 * 이미 실행된 Workflow의 재실행 시도를 나타냅니다.</p>
 *
 * <p>이 오류는 어떤 핸들러도 실행되기 전에 보고되며, 부수 효과가 없습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class ConstructionException extends WorkflowException {

    public static final String ERROR_CODE = "WF-CONSTRUCTION";

    /**
     * 생성자.
     *
     * @param message 위반 내용
     */
    public ConstructionException(String message) {
        super(ERROR_CODE, message, null);
    }
}
