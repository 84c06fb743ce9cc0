// file: engine/src/main/java/io/neural/engine/TableMetrics.java
package io.neural.engine;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory counters for one table's background work.
 * <p>
 * JVM-local and thread-safe via AtomicLong; read them through {@link #snapshot()}.
 */
public final class TableMetrics {

    private final AtomicLong compactions     = new AtomicLong();
    private final AtomicLong bytesReclaimed  = new AtomicLong();
    private final AtomicLong garbageTallied  = new AtomicLong();
    private final AtomicLong thresholdWakeups = new AtomicLong();
    private final AtomicLong dumps           = new AtomicLong();
    private final AtomicLong drains          = new AtomicLong();
    private final AtomicLong jobFailures     = new AtomicLong();

    void recordCompaction(long reclaimed) {
        compactions.incrementAndGet();
        bytesReclaimed.addAndGet(reclaimed);
    }

    void recordTallied(long bytes) {
        if (bytes > 0) garbageTallied.addAndGet(bytes);
    }

    void recordThresholdWakeup() { thresholdWakeups.incrementAndGet(); }

    void recordJob(JobKind kind) {
        switch (kind) {
            case DUMP -> dumps.incrementAndGet();
            case DRAIN -> drains.incrementAndGet();
        }
    }

    void recordJobFailure() { jobFailures.incrementAndGet(); }

    public long compactions() { return compactions.get(); }

    public Snapshot snapshot() {
        return new Snapshot(
                compactions.get(),
                bytesReclaimed.get(),
                garbageTallied.get(),
                thresholdWakeups.get(),
                dumps.get(),
                drains.get(),
                jobFailures.get()
        );
    }

    /**
     * Point-in-time copy of the counters.
     *
     * @param compactions      full GC passes completed (every shard compacted once per pass).
     * @param bytesReclaimed   arena bytes dropped by compaction.
     * @param garbageTallied   bytes the scanner has accounted so far.
     * @param thresholdWakeups times the scanner woke the GC worker.
     */
    public record Snapshot(
            long compactions,
            long bytesReclaimed,
            long garbageTallied,
            long thresholdWakeups,
            long dumps,
            long drains,
            long jobFailures
    ) {}
}
