package com.ryuqq.workflow.runner;

import java.util.ArrayList;
import java.util.List;

/**
 * 등록된 컴포넌트의 핸들.
 *
 * <p>{@link Workflow#addComponent}가 반환하며, 의존성 간선을 선언하는 용도로만 사용합니다.
 * 간선 방향은 "의존 대상 → 이 컴포넌트"입니다.</p>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>의존성 추가는 누적되며, execute 호출 전에만 가능</li>
 *   <li>다른 Workflow의 핸들을 의존 대상으로 지정하면 execute 시점에 구성 오류로 보고됨</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ComponentHandle {

    private final Workflow<?, ?> owner;
    private final int index;
    private final String name;
    private final List<ComponentHandle> dependencies = new ArrayList<>();

    ComponentHandle(Workflow<?, ?> owner, int index, String name) {
        this.owner = owner;
        this.index = index;
        this.name = name;
    }

    /**
     * 의존성 추가.
     *
     * <p>지정한 모든 컴포넌트가 성공해야 이 컴포넌트가 시작됩니다.</p>
     *
     * @param others 의존 대상 핸들
     * @return this (체이닝용)
     * @throws IllegalArgumentException others 또는 그 원소가 null인 경우
     * @throws IllegalStateException Workflow가 이미 실행된 경우
     */
    public ComponentHandle addDependencies(ComponentHandle... others) {
        if (others == null) {
            throw new IllegalArgumentException("dependencies cannot be null");
        }
        for (ComponentHandle other : others) {
            if (other == null) {
                throw new IllegalArgumentException("dependency cannot be null (component: " + name + ")");
            }
        }
        owner.appendDependencies(this, others);
        return this;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    Workflow<?, ?> getOwner() {
        return owner;
    }

    /**
     * 선언된 의존성 조회 (복사본).
     *
     * @return 의존 대상 핸들 목록
     */
    public List<ComponentHandle> getDependencies() {
        synchronized (owner) {
            return List.copyOf(dependencies);
        }
    }

    List<ComponentHandle> dependenciesView() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "ComponentHandle{'" + name + "' #" + index + "}";
    }
}
