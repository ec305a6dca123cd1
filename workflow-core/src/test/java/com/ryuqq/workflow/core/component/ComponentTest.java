package com.ryuqq.workflow.core.component;

import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.data.DataTracker;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.limiter.noop.NoOpConcurrencyLimiter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Component, ComponentConfig 테스트.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class ComponentTest {

    @Test
    void invoke_입력과_트래커를_핸들러에_전달() throws Exception {
        // given
        ExecutionContext ctx = ExecutionContext.background();
        DataTracker<String, List<String>> tracker = new DataTracker<>("prefix", new ArrayList<>(), ArrayList::new);
        Component<String, List<String>, Integer> component = Component.of("Writer", 3,
            (c, input, t) -> t.update(data -> data.add(t.getConfig() + "-" + input)));

        // when
        component.invoke(ctx, tracker);

        // then
        assertThat(tracker.getData()).containsExactly("prefix-3");
        assertThat(component.getName()).isEqualTo("Writer");
        assertThat(component.getInput()).isEqualTo(3);
    }

    @Test
    void invoke_핸들러_예외는_그대로_전파() {
        // given
        Component<Void, List<String>, Void> component = Component.of("Broken", (ctx, input, tracker) -> {
            throw new java.io.IOException("disk");
        });

        // when & then
        assertThatThrownBy(() -> component.invoke(ExecutionContext.background(),
            new DataTracker<>(null, new ArrayList<>())))
            .isInstanceOf(java.io.IOException.class)
            .hasMessage("disk");
    }

    @Test
    void of_입력_없는_컴포넌트() {
        Component<Void, Object, Void> component = Component.of("NoInput", (ctx, input, tracker) -> { });

        assertThat(component.getInput()).isNull();
    }

    @Test
    void of_타입_불일치_입력은_거부() {
        assertThatThrownBy(() -> Component.<Void, Object, Integer>of("Typed", Integer.class, "not a number",
            (ctx, input, tracker) -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("input type mismatch");
    }

    @Test
    void of_타입_일치_입력은_허용() {
        Component<Void, Object, Integer> component = Component.of("Typed", Integer.class, (Object) 42,
            (ctx, input, tracker) -> { });

        assertThat(component.getInput()).isEqualTo(42);
    }

    @Test
    void of_이름_또는_핸들러_누락은_거부() {
        assertThatThrownBy(() -> Component.of(" ", (ctx, input, tracker) -> { }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Component.<Void, Object>of("Name", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void componentConfig_기본값은_NoOp_Limiter() {
        ComponentConfig defaults = ComponentConfig.defaults();

        assertThat(defaults.concurrencyLimiter()).isNull();
        assertThat(defaults.effectiveLimiter()).isSameAs(NoOpConcurrencyLimiter.INSTANCE);
    }

    @Test
    void componentConfig_withLimiter() {
        ConcurrencyLimiter limiter = ConcurrencyLimiter.of(2);

        ComponentConfig config = ComponentConfig.withLimiter(limiter);

        assertThat(config.concurrencyLimiter()).isSameAs(limiter);
        assertThat(config.effectiveLimiter()).isSameAs(limiter);
        assertThatThrownBy(() -> ComponentConfig.withLimiter(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
