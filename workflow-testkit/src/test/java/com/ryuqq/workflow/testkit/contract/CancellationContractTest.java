package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.component.ComponentConfig;
import com.ryuqq.workflow.core.context.ExecutionContext;
import com.ryuqq.workflow.core.exception.LimiterAcquireException;
import com.ryuqq.workflow.core.exception.WorkflowCancelledException;
import com.ryuqq.workflow.core.limiter.ConcurrencyLimiter;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.core.outcome.NodeReport;
import com.ryuqq.workflow.core.statemachine.NodeState;
import com.ryuqq.workflow.runner.ComponentHandle;
import com.ryuqq.workflow.runner.Workflow;
import com.ryuqq.workflow.runner.WorkflowConfig;
import com.ryuqq.workflow.testkit.AbstractWorkflowContractTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: cancellation stops dispatching new components.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Deadline mid-run: pending components are skipped, execute returns promptly</li>
 *   <li>awaitRunningOnCancel: execute waits for running handlers to finish</li>
 *   <li>Cancellation while waiting on a limiter slot: the waiting component never starts</li>
 *   <li>A non-cooperative handler is left running in the default mode</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractWorkflowContractTest {

    private static List<String> newData() {
        return Collections.synchronizedList(new ArrayList<>());
    }

    @Test
    void testDeadline_SkipsPendingComponents() {
        // Given: First(1) → Long(5, cooperative) → Last, deadline at 2 units
        ExecutionContext deadline = ctx.withTimeout(units(2));
        Workflow<Void, List<String>> workflow = new Workflow<>();
        ComponentHandle first = workflow.addComponent(Component.of("First", timed("First", 1, list -> list.add("First"))));
        ComponentHandle longRunning = workflow.addComponent(Component.of("Long", timed("Long", 5, list -> list.add("Long"))))
            .addDependencies(first);
        workflow.addComponent(Component.of("Last", timed("Last", 0, list -> list.add("Last"))))
            .addDependencies(longRunning);

        // When
        ExecutionResult<List<String>> result = workflow.execute(deadline, null, newData());

        // Then
        WorkflowCancelledException error = assertFailed(result, WorkflowCancelledException.class);
        assertTrue(error.getMessage().contains("deadline exceeded"));
        assertEquals(List.of("First"), result.getData());
        assertEquals(NodeState.SUCCEEDED, result.getNodeReports("First").get(0).state());
        assertEquals(NodeState.SKIPPED, result.getNodeReports("Last").get(0).state());
        assertFalse(timeline.hasStarted("Last"));
        assertTrue(result.getElapsed().compareTo(units(2).plus(TOLERANCE)) <= 0,
            "execute should return soon after the deadline, took " + result.getElapsed().toMillis() + "ms");
    }

    @Test
    void testAwaitRunningOnCancel_WaitsForRunningHandlers() {
        // Given: Stubborn ignores cancellation and runs 3 units; Next depends on it
        Workflow<Void, List<String>> workflow = new Workflow<>(new WorkflowConfig().withAwaitRunningOnCancel(true));
        ComponentHandle stubborn = workflow.addComponent(Component.of("Stubborn", (handlerCtx, input, tracker) -> {
            Thread.sleep(units(3).toMillis());
            tracker.update(list -> list.add("Stubborn"));
        }));
        workflow.addComponent(Component.of("Next", timed("Next", 0, list -> list.add("Next"))))
            .addDependencies(stubborn);
        ExecutionContext deadline = ctx.withTimeout(units(1));

        // When
        ExecutionResult<List<String>> result = workflow.execute(deadline, null, newData());

        // Then
        assertFailed(result, WorkflowCancelledException.class);
        assertEquals(List.of("Stubborn"), result.getData());
        assertEquals(NodeState.SUCCEEDED, result.getNodeReports("Stubborn").get(0).state());
        assertEquals(NodeState.SKIPPED, result.getNodeReports("Next").get(0).state());
        assertFalse(timeline.hasStarted("Next"));
        assertTrue(result.getElapsed().compareTo(units(3)) >= 0,
            "execute should wait for the running handler, took " + result.getElapsed().toMillis() + "ms");
    }

    @Test
    void testDefaultMode_ReturnsWithoutWaitingForNonCooperativeHandler() {
        // Given
        Workflow<Void, List<String>> workflow = new Workflow<>();
        workflow.addComponent(Component.of("Stubborn", (handlerCtx, input, tracker) -> {
            Thread.sleep(units(5).toMillis());
            tracker.update(list -> list.add("Stubborn"));
        }));
        ExecutionContext deadline = ctx.withTimeout(units(1));

        // When
        ExecutionResult<List<String>> result = workflow.execute(deadline, null, newData());

        // Then
        assertFailed(result, WorkflowCancelledException.class);
        assertEquals(1, result.countNodes(NodeState.RUNNING));
        assertTrue(result.getElapsed().compareTo(units(3)) < 0,
            "execute should not wait for the stubborn handler, took " + result.getElapsed().toMillis() + "ms");
    }

    @Test
    void testCancelWhileWaitingForLimiterSlot_WaitingComponentNeverStarts() throws Exception {
        // Given: capacity 1, whichever component wins the slot holds it for 5 units (cooperative)
        ConcurrencyLimiter limiter = ConcurrencyLimiter.of(1);
        Workflow<Void, List<String>> workflow = new Workflow<>();
        workflow.addComponent(Component.of("SlotA", timed("SlotA", 5, list -> list.add("SlotA"))),
            ComponentConfig.withLimiter(limiter));
        workflow.addComponent(Component.of("SlotB", timed("SlotB", 5, list -> list.add("SlotB"))),
            ComponentConfig.withLimiter(limiter));
        ExecutionContext deadline = ctx.withTimeout(units(1));

        // When
        ExecutionResult<List<String>> result = workflow.execute(deadline, null, newData());

        // Then
        assertFailed(result, WorkflowCancelledException.class);
        assertEquals(1, timeline.startedCount(), "Only one of the two components can have started");
        assertTrue(result.getData().isEmpty());

        // the queued component is either skipped by the coordinator or failed by its aborted acquire
        String queued = timeline.hasStarted("SlotA") ? "SlotB" : "SlotA";
        NodeReport queuedReport = result.getNodeReports(queued).get(0);
        if (queuedReport.state() == NodeState.FAILED) {
            assertInstanceOf(LimiterAcquireException.class, queuedReport.error());
        } else {
            assertEquals(NodeState.SKIPPED, queuedReport.state());
        }

        // the cooperative holder gives its slot back shortly after the deadline
        long waitUntil = System.currentTimeMillis() + 2_000;
        while (limiter.getCurrentConcurrency() > 0 && System.currentTimeMillis() < waitUntil) {
            Thread.sleep(10);
        }
        assertEquals(0, limiter.getCurrentConcurrency());
    }

    @Test
    void testCancelledBeforeExecute_NothingRuns() {
        // Given
        Workflow<Void, List<String>> workflow = new Workflow<>();
        workflow.addComponent(Component.of("A", timed("A", 0, list -> list.add("A"))));
        ctx.cancel("shutdown");

        // When
        ExecutionResult<List<String>> result = workflow.execute(ctx, null, newData());

        // Then
        WorkflowCancelledException error = assertFailed(result, WorkflowCancelledException.class);
        assertTrue(error.getMessage().contains("shutdown"));
        assertEquals(0, timeline.startedCount());
        assertEquals(NodeState.SKIPPED, result.getNodeReports("A").get(0).state());
    }

    @Test
    void testInterruptingExecute_CountsAsCancellation() throws Exception {
        // Given
        Workflow<Void, List<String>> workflow = new Workflow<>();
        workflow.addComponent(Component.of("Slow", timed("Slow", 10, list -> list.add("Slow"))));
        AtomicReference<ExecutionResult<List<String>>> holder = new AtomicReference<>();
        AtomicBoolean interruptFlagKept = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            holder.set(workflow.execute(ctx, null, newData()));
            interruptFlagKept.set(Thread.currentThread().isInterrupted());
        });

        // When
        caller.start();
        Thread.sleep(units(1).toMillis());
        caller.interrupt();
        caller.join(5_000);

        // Then
        ExecutionResult<List<String>> result = holder.get();
        assertNotNull(result, "execute should return after the interrupt");
        WorkflowCancelledException error = assertFailed(result, WorkflowCancelledException.class);
        assertTrue(error.getMessage().contains("interrupted"));
        assertTrue(interruptFlagKept.get(), "The interrupt flag should be restored");
        assertFalse(ctx.isCancelled(), "The caller's context is not cancelled by the engine");
    }
}
