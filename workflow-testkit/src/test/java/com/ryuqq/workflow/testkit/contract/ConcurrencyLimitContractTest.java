package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.component.ComponentConfig;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.runner.Workflow;
import com.ryuqq.workflow.testkit.AbstractWorkflowContractTest;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: a limiter of capacity K bounds concurrently running handlers to K.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>N components of duration d behind capacity K take ⌈N/K⌉·d</li>
 *   <li>A limiter shared by two workflows bounds their combined fan-out</li>
 *   <li>A limiter threaded into nested workflows bounds the inner handlers</li>
 *   <li>Only bound components are limited</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class ConcurrencyLimitContractTest extends AbstractWorkflowContractTest {

    @Test
    void testLimiter_BoundsConcurrencyAndBatchesWork() {
        // Given: 10 components of 1 unit behind capacity 3 → ⌈10/3⌉ = 4 units
        ConcurrencyLimiter limiter = ConcurrencyLimiter.of(3);
        Workflow<Void, AtomicInteger> workflow = new Workflow<>();
        for (int i = 0; i < 10; i++) {
            String name = "Limited-" + i;
            workflow.addComponent(Component.of(name, timed(name, 1, AtomicInteger::incrementAndGet)),
                ComponentConfig.withLimiter(limiter));
        }

        // When
        ExecutionResult<AtomicInteger> result = workflow.execute(ctx, null, new AtomicInteger());

        // Then
        assertDone(result);
        assertEquals(10, result.getData().get());
        assertEquals(3, probe.getMaxConcurrency());
        assertEquals(0, limiter.getCurrentConcurrency(), "Every slot must be released");
        assertElapsedAbout(result, 4);
    }

    @Test
    void testLimiter_UnboundComponentsAreNotLimited() {
        // Given: 4 limited components behind capacity 1, plus 1 unlimited
        ConcurrencyLimiter limiter = ConcurrencyLimiter.of(1);
        Workflow<Void, AtomicInteger> workflow = new Workflow<>();
        for (int i = 0; i < 4; i++) {
            String name = "Limited-" + i;
            workflow.addComponent(Component.of(name, timed(name, 1, AtomicInteger::incrementAndGet)),
                ComponentConfig.withLimiter(limiter));
        }
        workflow.addComponent(Component.of("Free", timed("Free", 1, AtomicInteger::incrementAndGet)));

        // When
        ExecutionResult<AtomicInteger> result = workflow.execute(ctx, null, new AtomicInteger());

        // Then
        assertDone(result);
        assertEquals(2, probe.getMaxConcurrency());
        assertTrue(timeline.startOffset("Free").toMillis() < UNIT.toMillis(),
            "Unlimited component should not wait for the limiter");
        assertElapsedAbout(result, 4);
    }

    @Test
    void testLimiter_SharedAcrossConcurrentWorkflows() throws Exception {
        // Given: two workflows of 4 components each, one limiter of capacity 2
        ConcurrencyLimiter limiter = ConcurrencyLimiter.of(2);
        Workflow<Void, AtomicInteger> first = new Workflow<>();
        Workflow<Void, AtomicInteger> second = new Workflow<>();
        for (int i = 0; i < 4; i++) {
            first.addComponent(Component.of("First-" + i, timed("First-" + i, 1, AtomicInteger::incrementAndGet)),
                ComponentConfig.withLimiter(limiter));
            second.addComponent(Component.of("Second-" + i, timed("Second-" + i, 1, AtomicInteger::incrementAndGet)),
                ComponentConfig.withLimiter(limiter));
        }

        // When
        AtomicInteger secondCount = new AtomicInteger();
        Thread secondRunner = new Thread(() -> second.execute(ctx, null, secondCount));
        secondRunner.start();
        ExecutionResult<AtomicInteger> firstResult = first.execute(ctx, null, new AtomicInteger());
        secondRunner.join(10_000);

        // Then
        assertDone(firstResult);
        assertEquals(4, secondCount.get());
        assertEquals(2, probe.getMaxConcurrency());
        assertEquals(0, limiter.getCurrentConcurrency());
    }

    @Test
    void testLimiter_ThreadedIntoNestedWorkflows() {
        // Given: 4 outer components (unlimited), each running a nested workflow of 3 inner components
        // bound to one shared limiter of capacity 4 → 12 inner units / 4 = 3 units
        ConcurrencyLimiter innerLimiter = ConcurrencyLimiter.of(4);
        Workflow<Void, AtomicInteger> outer = new Workflow<>();
        for (int i = 0; i < 4; i++) {
            String outerName = "Outer-" + i;
            outer.addComponent(Component.of(outerName, (outerCtx, input, tracker) -> {
                Workflow<Void, AtomicInteger> inner = new Workflow<>();
                for (int j = 0; j < 3; j++) {
                    String innerName = outerName + "/Inner-" + j;
                    inner.addComponent(Component.of(innerName, timed(innerName, 1, AtomicInteger::incrementAndGet)),
                        ComponentConfig.withLimiter(innerLimiter));
                }
                ExecutionResult<AtomicInteger> innerResult = inner.execute(outerCtx, null, new AtomicInteger());
                if (!innerResult.isDone()) {
                    throw innerResult.getErrorOrNull();
                }
                tracker.update(total -> total.addAndGet(innerResult.getData().get()));
            }));
        }

        // When
        ExecutionResult<AtomicInteger> result = outer.execute(ctx, null, new AtomicInteger());

        // Then
        assertDone(result);
        assertEquals(12, result.getData().get());
        assertEquals(4, probe.getMaxConcurrency());
        assertElapsedAbout(result, 3);
    }
}
