// file: engine/src/main/java/io/neural/engine/GarbageCollector.java
package io.neural.engine;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GC worker: compacts every shard of a table when woken.
 * <p>
 * Wake conditions:
 *  - the reclamation scanner saw a shard cross the reclaim threshold,
 *  - a caller asked for a collection via {@link #request()},
 *  - the table's tallied garbage already exceeds the threshold when the worker
 *    checks before sleeping.
 * <p>
 * One pass visits shards in index order. For each shard it takes the write lock,
 * copies live values into a fresh arena, swaps the arena in, resets the garbage
 * list and counter, drops the lock and only then releases the old arena.
 * <p>
 * A failure during a pass is not retried: it is logged, recorded on the table and
 * ends the worker, because silently skipping compactions lets memory grow unbounded.
 */
final class GarbageCollector {
    private static final Logger log = Logger.getLogger(GarbageCollector.class.getName());

    private final NeuralTable table;
    private final long threshold;
    private final ExecutorService worker;

    private final ReentrantLock mutex = new ReentrantLock();
    private final Condition wakeup = mutex.newCondition();

    // guarded by mutex
    private boolean requested;
    private volatile boolean running = true;

    // runs for each shard right before it is compacted; tests use it to inject failures
    private volatile Consumer<Shard> beforeCompact = shard -> { };

    GarbageCollector(NeuralTable table, TableOptions options) {
        this.table = table;
        this.threshold = options.reclaimThresholdBytes();
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "neural-gc-" + table.name());
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        worker.execute(this::loop);
    }

    /** Wake the worker; it compacts only if garbage is over threshold. */
    void wake() {
        mutex.lock();
        try {
            wakeup.signal();
        } finally {
            mutex.unlock();
        }
    }

    /** Wake the worker and force one pass regardless of threshold. */
    void request() {
        mutex.lock();
        try {
            requested = true;
            wakeup.signal();
        } finally {
            mutex.unlock();
        }
    }

    void beforeCompact(Consumer<Shard> hook) {
        this.beforeCompact = Objects.requireNonNull(hook, "hook");
    }

    void stop() {
        running = false;
        wake();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
                log.warning(() -> "gc worker for " + table.name() + " did not stop within 5s");
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private void loop() {
        while (running) {
            mutex.lock();
            try {
                while (running && !requested && table.garbageSize() < threshold) {
                    wakeup.await();
                }
                if (!running) {
                    return;
                }
                requested = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                mutex.unlock();
            }

            try {
                collect();
            } catch (RuntimeException | Error e) {
                log.log(Level.SEVERE, "gc worker for table " + table.name()
                        + " failed; compaction stopped for this table", e);
                table.recordGcFailure(e);
                throw e;
            }
        }
    }

    /** One full pass over every shard. */
    void collect() {
        long reclaimed = 0L;
        long tallied = 0L;
        for (int i = 0; i < table.shardCount(); i++) {
            Shard shard = table.shard(i);
            beforeCompact.accept(shard);
            Shard.Compaction c;
            Lock w = shard.writeLock();
            w.lock();
            try {
                c = shard.compact();
            } finally {
                w.unlock();
            }
            c.retired().release();
            final int index = i;
            final Shard.Compaction done = c;
            log.fine(() -> "table %s shard %d compacted: reclaimed=%d bytes"
                    .formatted(table.name(), index, done.reclaimedBytes()));
            reclaimed += c.reclaimedBytes();
            tallied += c.talliedBytes();
        }
        table.metricsSink().recordCompaction(reclaimed);

        final long r = reclaimed;
        final long t = tallied;
        log.info(() -> "table %s compacted %d shards: reclaimed=%d bytes, tallied garbage=%d bytes"
                .formatted(table.name(), table.shardCount(), r, t));
    }
}
