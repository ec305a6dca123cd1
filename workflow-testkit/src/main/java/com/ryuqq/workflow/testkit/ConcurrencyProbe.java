package com.ryuqq.workflow.testkit;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many handlers are inside a guarded region at once, and the peak.
 *
 * <pre>
 * try (ConcurrencyProbe.Entry entry = probe.enter()) {
 *     ctx.sleep(duration);
 * }
 * assertTrue(probe.getMaxConcurrency() &lt;= 50);
 * </pre>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public final class ConcurrencyProbe {

    private final AtomicInteger current = new AtomicInteger(0);
    private final AtomicInteger max = new AtomicInteger(0);
    private final AtomicInteger total = new AtomicInteger(0);

    /**
     * Enters the guarded region.
     *
     * @return an entry that leaves the region when closed
     */
    public Entry enter() {
        int now = current.incrementAndGet();
        max.accumulateAndGet(now, Math::max);
        total.incrementAndGet();
        return new Entry();
    }

    public int getCurrentConcurrency() {
        return current.get();
    }

    public int getMaxConcurrency() {
        return max.get();
    }

    /**
     * @return number of times the region was entered
     */
    public int getTotalEntries() {
        return total.get();
    }

    /**
     * Resets all counters.
     */
    public void reset() {
        current.set(0);
        max.set(0);
        total.set(0);
    }

    /**
     * A single occupancy of the guarded region.
     */
    public final class Entry implements AutoCloseable {

        private boolean closed;

        private Entry() {
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                current.decrementAndGet();
            }
        }
    }
}
