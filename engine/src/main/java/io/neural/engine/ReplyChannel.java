// file: engine/src/main/java/io/neural/engine/ReplyChannel.java
package io.neural.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Mailbox-style {@link Requester}: the table's batch worker sends into it,
 * the caller that enqueued the job receives from it.
 * <p>
 * One channel may be reused for several jobs; replies arrive in completion
 * order, which for a single table is submission order.
 */
public final class ReplyChannel implements Requester {

    private record Delivery(long jobId, BatchResult result, RuntimeException failure) {}

    private final BlockingQueue<Delivery> inbox = new LinkedBlockingQueue<>();

    @Override
    public void send(BatchResult result) {
        Objects.requireNonNull(result, "result");
        inbox.add(new Delivery(result.jobId(), result, null));
    }

    @Override
    public void fail(long jobId, RuntimeException cause) {
        Objects.requireNonNull(cause, "cause");
        inbox.add(new Delivery(jobId, null, cause));
    }

    /**
     * Wait for the next reply.
     *
     * @throws TimeoutException if nothing arrives within {@code timeout}.
     * @throws RuntimeException the failure reported for the job, rethrown as-is.
     */
    public BatchResult receive(Duration timeout) throws InterruptedException, TimeoutException {
        Delivery d = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (d == null) {
            throw new TimeoutException("no batch reply within " + timeout);
        }
        return unwrap(d);
    }

    /**
     * Wait for the next reply with no timeout, ignoring interrupts until it
     * arrives. The interrupt status is restored before returning.
     *
     * @throws RuntimeException the failure reported for the job, rethrown as-is.
     */
    public BatchResult receiveUninterruptibly() {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return unwrap(inbox.take());
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static BatchResult unwrap(Delivery d) {
        if (d.failure() != null) {
            throw d.failure();
        }
        return d.result();
    }

    /** Replies waiting to be received. */
    public int pending() {
        return inbox.size();
    }
}
