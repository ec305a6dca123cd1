package com.ryuqq.workflow.core.component;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;

/**
 * 컴포넌트 작업 함수.
 *
 * <p>Workflow 경계를 넘는 유일한 외부 협력자입니다. 핸들러는 결과값을
 * {@link DataTracker}를 통해서만 읽고 변경해야 하며, 취소 신호를 직접 관찰해야 합니다.</p>
 *
 * <p>예외를 던지면 해당 노드는 실패로 기록되고, 전이적 하위 노드는 실행되지 않습니다.
 * 핸들러 내부에서 중첩 Workflow를 구성하고 실행할 수 있습니다.</p>
 *
 * @param <C> 설정 타입
 * @param <D> 결과 타입
 * @param <I> 입력 타입
 * @author Workflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ComponentHandler<C, D, I> {

    /**
     * 작업 실행.
     *
     * @param ctx 취소 신호
     * @param input 컴포넌트 입력값
     * @param tracker 공유 결과 접근자
     * @throws Exception 작업 실패
     */
    void handle(ExecutionContext ctx, I input, DataTracker<C, D> tracker) throws Exception;
}
