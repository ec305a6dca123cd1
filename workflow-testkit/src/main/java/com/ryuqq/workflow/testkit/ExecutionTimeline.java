package com.ryuqq.workflow.testkit;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records handler start and end instants by component label.
 *
 * <p>Labels must be unique per timeline; recording the same label twice is treated as a test bug.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (ExecutionTimeline.Span span = timeline.span("Parameter1")) {
 *     ctx.sleep(duration);
 * }
 * assertTrue(timeline.startOf("Parameter1") &gt;= timeline.endOf("TextExtractor"));
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ExecutionTimeline {

    private final long originNanos = System.nanoTime();
    private final Map<String, Long> starts = new ConcurrentHashMap<>();
    private final Map<String, Long> ends = new ConcurrentHashMap<>();

    /**
     * Opens a span for the given label; closing it records the end instant.
     *
     * @param label the component label
     * @return an open span
     * @throws IllegalStateException if the label was already started
     */
    public Span span(String label) {
        if (starts.putIfAbsent(label, System.nanoTime()) != null) {
            throw new IllegalStateException("Label already recorded: " + label);
        }
        return new Span(label);
    }

    /**
     * @param label the component label
     * @return true if a span for the label has been opened
     */
    public boolean hasStarted(String label) {
        return starts.containsKey(label);
    }

    /**
     * @param label the component label
     * @return start instant in nanos (System.nanoTime based)
     * @throws IllegalStateException if the label never started
     */
    public long startOf(String label) {
        Long start = starts.get(label);
        if (start == null) {
            throw new IllegalStateException("No start recorded for: " + label);
        }
        return start;
    }

    /**
     * @param label the component label
     * @return end instant in nanos (System.nanoTime based)
     * @throws IllegalStateException if the label never finished
     */
    public long endOf(String label) {
        Long end = ends.get(label);
        if (end == null) {
            throw new IllegalStateException("No end recorded for: " + label);
        }
        return end;
    }

    /**
     * Offset of the label's start from the timeline's creation.
     *
     * @param label the component label
     * @return start offset
     */
    public Duration startOffset(String label) {
        return Duration.ofNanos(startOf(label) - originNanos);
    }

    /**
     * @return number of started labels
     */
    public int startedCount() {
        return starts.size();
    }

    /**
     * Clears all recorded spans.
     */
    public void clear() {
        starts.clear();
        ends.clear();
    }

    /**
     * An open span. Closing it records the end instant.
     */
    public final class Span implements AutoCloseable {

        private final String label;

        private Span(String label) {
            this.label = label;
        }

        @Override
        public void close() {
            ends.put(label, System.nanoTime());
        }
    }
}
