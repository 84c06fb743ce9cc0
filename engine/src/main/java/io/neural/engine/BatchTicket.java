// file: engine/src/main/java/io/neural/engine/BatchTicket.java
package io.neural.engine;

/**
 * Returned immediately by {@code dump} / {@code drain}: the job is queued and its
 * payload will arrive at the requester as a {@link BatchResult} with the same id.
 * A ticket never carries table data.
 */
public record BatchTicket(long jobId, JobKind kind) {}
