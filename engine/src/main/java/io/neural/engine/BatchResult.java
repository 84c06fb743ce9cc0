// file: engine/src/main/java/io/neural/engine/BatchResult.java
package io.neural.engine;

import io.neural.core.Term;

import java.util.List;

/**
 * Payload delivered to a requester once a batch job has run.
 *
 * @param jobId  id from the {@link BatchTicket} handed out at enqueue time.
 * @param kind   DUMP or DRAIN.
 * @param values every value collected, in no particular order.
 */
public record BatchResult(long jobId, JobKind kind, List<Term> values) {
    public BatchResult {
        values = List.copyOf(values);
    }
}
