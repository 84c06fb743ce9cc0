// file: engine/src/main/java/io/neural/engine/Arena.java
package io.neural.engine;

import io.neural.core.Term;

/**
 * Bulk-ownership region for the values of one shard.
 * <p>
 * Every value stored in a shard is copied in through {@link #copyIn(Term)}, so the
 * arena's byte count covers live values and superseded ones alike. Compaction
 * replaces the arena with a {@link #successor()} holding copies of the live values
 * only, then {@link #release()}s the old one as a unit.
 * <p>
 * Not thread-safe: guarded by the owning shard's lock.
 */
final class Arena {
    private final long generation;
    private long allocatedBytes;
    private long allocations;
    private boolean released;

    Arena(long generation) {
        this.generation = generation;
    }

    /** Copy {@code value} into this arena and account for it. */
    Term copyIn(Term value) {
        if (released) {
            throw new IllegalStateException("arena generation " + generation + " already released");
        }
        Term copy = value.deepCopy();
        allocatedBytes += copy.estimatedBytes();
        allocations++;
        return copy;
    }

    /** Fresh, empty arena for the next epoch. */
    Arena successor() {
        return new Arena(generation + 1);
    }

    /** Drop all accounting in place (used when a shard is emptied without compaction). */
    void reset() {
        allocatedBytes = 0L;
        allocations = 0L;
    }

    /** Discard the arena; any further copyIn fails. */
    void release() {
        released = true;
        allocatedBytes = 0L;
        allocations = 0L;
    }

    long generation() { return generation; }

    long allocatedBytes() { return allocatedBytes; }

    long allocations() { return allocations; }

    boolean released() { return released; }
}
