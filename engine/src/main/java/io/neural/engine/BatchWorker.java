// file: engine/src/main/java/io/neural/engine/BatchWorker.java
package io.neural.engine;

import io.neural.core.TableClosedException;
import io.neural.core.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes whole-table jobs through a FIFO queue and one worker thread.
 * <p>
 * Semantics:
 *  - {@link #submit} enqueues and returns a ticket immediately.
 *  - Jobs run strictly in submission order; two jobs never interleave.
 *  - The result (or failure) is handed to the job's {@link Requester} from the
 *    worker thread.
 *  - On stop, jobs still queued are failed with TABLE_CLOSED.
 */
final class BatchWorker {
    private static final Logger log = Logger.getLogger(BatchWorker.class.getName());

    private final NeuralTable table;
    private final BlockingQueue<BatchJob> queue = new LinkedBlockingQueue<>();
    private final AtomicLong ids = new AtomicLong();
    private final ExecutorService worker;

    // guarded by this
    private boolean running = true;

    BatchWorker(NeuralTable table) {
        this.table = table;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "neural-batch-" + table.name());
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        worker.execute(this::loop);
    }

    synchronized BatchTicket submit(JobKind kind, Requester requester) {
        if (!running) {
            throw new TableClosedException(table.name());
        }
        long id = ids.incrementAndGet();
        BatchJob job = switch (kind) {
            case DUMP -> new BatchJob.Dump(id, requester);
            case DRAIN -> new BatchJob.Drain(id, requester);
        };
        queue.add(job);
        return new BatchTicket(id, kind);
    }

    int queued() {
        return queue.size();
    }

    void stop() {
        synchronized (this) {
            running = false;
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning(() -> "batch worker for " + table.name() + " did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<BatchJob> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        for (BatchJob job : leftover) {
            deliverFailure(job, new TableClosedException(table.name()));
        }
    }

    // ---------- internals ----------

    private void loop() {
        while (!Thread.currentThread().isInterrupted()) {
            BatchJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            run(job);
        }
    }

    private void run(BatchJob job) {
        List<Term> values;
        try {
            if (job instanceof BatchJob.Dump) {
                values = table.collectForDump();
            } else if (job instanceof BatchJob.Drain) {
                values = table.collectForDrain();
            } else {
                throw new IllegalStateException("Unknown batch job type: " + job);
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "batch job " + job.id() + " (" + job.kind() + ") failed on table "
                    + table.name(), e);
            table.metricsSink().recordJobFailure();
            deliverFailure(job, e);
            return;
        }

        table.metricsSink().recordJob(job.kind());
        log.fine(() -> "table %s job %d %s collected %d values"
                .formatted(table.name(), job.id(), job.kind(), values.size()));
        try {
            job.requester().send(new BatchResult(job.id(), job.kind(), values));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "requester rejected reply for job " + job.id(), e);
        }
    }

    private void deliverFailure(BatchJob job, RuntimeException cause) {
        try {
            job.requester().fail(job.id(), cause);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "requester rejected failure for job " + job.id(), e);
        }
    }
}
