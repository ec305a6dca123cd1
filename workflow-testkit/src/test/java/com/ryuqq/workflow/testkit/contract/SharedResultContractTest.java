package com.ryuqq.workflow.testkit.contract;

import com.ryuqq.workflow.core.component.Component;
import com.ryuqq.workflow.core.outcome.ExecutionResult;
import com.ryuqq.workflow.runner.ComponentHandle;
import com.ryuqq.workflow.runner.Workflow;
import com.ryuqq.workflow.testkit.AbstractWorkflowContractTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: concurrent components mutate the shared result without lost or torn updates.
 *
 * @author Workflow Team
 * @since 1.0.0
 */
class SharedResultContractTest extends AbstractWorkflowContractTest {

    /**
     * Unsynchronized result type; safety comes from the tracker alone.
     */
    static final class Tally {
        final Map<String, Integer> counts = new HashMap<>();
        final List<String> entries = new ArrayList<>();
        int total;
    }

    @Test
    void testConcurrentUpdates_FinalResultIsCompositionOfAllMutations() {
        // Given: 32 independent components, each performing 200 read-modify-write updates
        int components = 32;
        int updatesPerComponent = 200;
        Workflow<String, Tally> workflow = new Workflow<>();
        for (int i = 0; i < components; i++) {
            String key = "key-" + (i % 4);
            workflow.addComponent(Component.of("Writer-" + i, key, (handlerCtx, input, tracker) -> {
                for (int n = 0; n < updatesPerComponent; n++) {
                    tracker.update(tally -> {
                        tally.counts.merge(input, 1, Integer::sum);
                        tally.entries.add(tracker.getConfig() + ":" + input);
                        tally.total++;
                    });
                }
            }));
        }

        // When
        ExecutionResult<Tally> result = workflow.execute(ctx, "run", new Tally());

        // Then
        assertDone(result);
        Tally tally = result.getData();
        assertEquals(components * updatesPerComponent, tally.total);
        assertEquals(components * updatesPerComponent, tally.entries.size());
        for (int k = 0; k < 4; k++) {
            assertEquals(components / 4 * updatesPerComponent, tally.counts.get("key-" + k));
        }
        assertTrue(tally.entries.stream().allMatch(entry -> entry.startsWith("run:key-")));
    }

    @Test
    void testDependentReadsUpstreamWrites() {
        // Given: Producer writes, Consumer reads what Producer wrote
        Workflow<Void, Map<String, String>> workflow = new Workflow<>();
        ComponentHandle producer = workflow.addComponent(Component.of("Producer",
            timed("Producer", 1, map -> map.put("greeting", "hello"))));
        workflow.addComponent(Component.of("Consumer", (handlerCtx, input, tracker) -> {
            String upstream = tracker.read(map -> map.get("greeting"));
            tracker.update(map -> map.put("reply", upstream + " world"));
        })).addDependencies(producer);

        // When
        ExecutionResult<Map<String, String>> result = workflow.execute(ctx, null, new HashMap<>());

        // Then
        assertDone(result);
        assertEquals("hello world", result.getData().get("reply"));
    }
}
