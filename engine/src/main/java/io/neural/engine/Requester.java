// file: engine/src/main/java/io/neural/engine/Requester.java
package io.neural.engine;

/**
 * Sending side of the reply path for batch jobs.
 * <p>
 * Implementations are called from the table's batch worker thread and must not
 * block for long: the next queued job waits behind them. Delivery guarantees
 * beyond "called once per job" belong to the implementation.
 */
public interface Requester {

    /** Job completed; {@code result.jobId()} matches the ticket. */
    void send(BatchResult result);

    /** Job could not run (table closed, or the job itself failed). */
    void fail(long jobId, RuntimeException cause);
}
