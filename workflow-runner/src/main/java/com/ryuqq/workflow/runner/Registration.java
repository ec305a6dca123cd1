package com.ryuqq.workflow.runner;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.component.ComponentConfig;

/**
 * 등록된 노드 (핸들, 컴포넌트, 등록 옵션).
 */
record Registration<C, D>(
    ComponentHandle handle,
    Component<C, D, ?> component,
    ComponentConfig componentConfig
) {
}
