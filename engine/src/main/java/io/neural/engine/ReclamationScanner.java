// file: engine/src/main/java/io/neural/engine/ReclamationScanner.java
package io.neural.engine;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background pass that turns pending garbage into a byte count.
 * <p>
 * Every {@code scanInterval}, for each shard in index order:
 *  - take the shard's write lock,
 *  - pop up to {@code scanBatchSize} pending values and add their estimated size
 *    to the shard's counter,
 *  - release the lock,
 *  - wake the GC worker if the shard's counter reached the reclaim threshold.
 * <p>
 * The scanner never compacts by itself. A single-threaded scheduler with fixed
 * delay guarantees passes never overlap.
 */
final class ReclamationScanner {
    private static final Logger log = Logger.getLogger(ReclamationScanner.class.getName());

    private final NeuralTable table;
    private final GarbageCollector gc;
    private final int batchSize;
    private final long threshold;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    ReclamationScanner(NeuralTable table, GarbageCollector gc, TableOptions options) {
        this.table = table;
        this.gc = gc;
        this.batchSize = options.scanBatchSize();
        this.threshold = options.reclaimThresholdBytes();
        this.interval = options.scanInterval();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "neural-reclaimer-" + table.name());
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        scheduler.scheduleWithFixedDelay(
                this::passSafe,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    void stop() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning(() -> "reclaimer for " + table.name() + " did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void passSafe() {
        try {
            pass();
        } catch (RuntimeException e) {
            // A skipped pass only delays accounting; the next one picks up where this left off.
            log.log(Level.WARNING, "reclamation pass failed for table " + table.name(), e);
        }
    }

    void pass() {
        for (int i = 0; i < table.shardCount(); i++) {
            Shard shard = table.shard(i);
            long before;
            long after;
            Lock w = shard.writeLock();
            w.lock();
            try {
                before = shard.garbageBytes();
                after = shard.tally(batchSize);
            } finally {
                w.unlock();
            }
            table.metricsSink().recordTallied(after - before);

            if (after >= threshold) {
                final int idx = i;
                final long bytes = after;
                log.fine(() -> "table %s shard %d garbage %d >= %d, waking gc"
                        .formatted(table.name(), idx, bytes, threshold));
                table.metricsSink().recordThresholdWakeup();
                gc.wake();
            }
        }
    }
}
