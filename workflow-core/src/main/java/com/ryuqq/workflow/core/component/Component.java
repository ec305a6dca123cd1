package com.ryuqq.workflow.core.component;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;

/**
 * 그래프 노드로 등록되는 작업 단위.
 *
 * <p>이름(진단용, 중복 허용), 생성 시 고정되는 입력값, 핸들러로 구성됩니다.
 * 의존성 간선과 Limiter 바인딩은 Workflow에 등록할 때 지정합니다.</p>
 *
 * <p><strong>입력 타입 검증:</strong></p>
 * <ul>
 *   <li>{@link #of(String, Object, ComponentHandler)}: 컴파일 타임에 핸들러 입력 타입과 일치 강제</li>
 *   <li>{@link #of(String, Class, Object, ComponentHandler)}: 타입 정보 없이 전달된 입력을
 *       생성 시점에 검증 (불일치 시 IllegalArgumentException)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Component<DocConfig, DocData, PageInput> page = Component.of(
 *     "PageAnalysis",
 *     new PageInput(3),
 *     (ctx, input, tracker) -> analyze(ctx, input.index(), tracker)
 * );
 * }</pre>
 *
 * @param <C> 설정 타입
 * @param <D> 결과 타입
 * @param <I> 입력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
public final class Component<C, D, I> {

    private final String name;
    private final I input;
    private final ComponentHandler<C, D, I> handler;

    private Component(String name, I input, ComponentHandler<C, D, I> handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        this.name = name;
        this.input = input;
        this.handler = handler;
    }

    /**
     * 컴포넌트 생성.
     *
     * @param name 컴포넌트 이름
     * @param input 입력값 (null 허용)
     * @param handler 핸들러
     * @return Component 인스턴스
     * @throws IllegalArgumentException name이 null/blank이거나 handler가 null인 경우
     */
    public static <C, D, I> Component<C, D, I> of(String name, I input, ComponentHandler<C, D, I> handler) {
        return new Component<>(name, input, handler);
    }

    /**
     * 입력 없는 컴포넌트 생성.
     *
     * @param name 컴포넌트 이름
     * @param handler 핸들러 (입력은 항상 null)
     * @return Component 인스턴스
     */
    public static <C, D> Component<C, D, Void> of(String name, ComponentHandler<C, D, Void> handler) {
        return new Component<>(name, null, handler);
    }

    /**
     * 런타임 타입 검증을 거친 컴포넌트 생성.
     *
     * <p>설정 파일 등 타입 정보 없이 전달된 입력값을 핸들러 입력 타입에 바인딩합니다.</p>
     *
     * @param name 컴포넌트 이름
     * @param inputType 핸들러가 선언한 입력 타입
     * @param rawInput 입력값 (null 허용)
     * @param handler 핸들러
     * @return Component 인스턴스
     * @throws IllegalArgumentException inputType이 null이거나 rawInput이 inputType의 인스턴스가 아닌 경우
     */
    public static <C, D, I> Component<C, D, I> of(String name, Class<I> inputType, Object rawInput,
                                                  ComponentHandler<C, D, I> handler) {
        if (inputType == null) {
            throw new IllegalArgumentException("inputType cannot be null");
        }
        if (rawInput != null && !inputType.isInstance(rawInput)) {
            throw new IllegalArgumentException(String.format(
                "Component '%s' input type mismatch: handler expects %s but got %s",
                name, inputType.getName(), rawInput.getClass().getName()));
        }
        return new Component<>(name, inputType.cast(rawInput), handler);
    }

    /**
     * 핸들러 호출.
     *
     * @param ctx 취소 신호
     * @param tracker 공유 결과 접근자
     * @throws Exception 핸들러가 던진 예외
     */
    public void invoke(ExecutionContext ctx, DataTracker<C, D> tracker) throws Exception {
        handler.handle(ctx, input, tracker);
    }

    public String getName() {
        return name;
    }

    public I getInput() {
        return input;
    }

    @Override
    public String toString() {
        return "Component{name='" + name + "', input=" + input + "}";
    }
}
