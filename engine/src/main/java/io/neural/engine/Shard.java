// file: engine/src/main/java/io/neural/engine/Shard.java
package io.neural.engine;

import io.neural.core.Term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One partition of a table: key -> value map, the arena that owns the values,
 * and the pending-garbage list with its tallied byte counter.
 * <p>
 * Locking:
 *  - The shard's read/write lock is the only synchronization for everything here.
 *  - {@link #put}, {@link #find}, {@link #erase}, {@link #reclaim} and the other
 *    state methods assume the caller holds the lock in the right mode
 *    (shared for reads, exclusive for anything that mutates).
 */
final class Shard {
    private final int index;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private final Map<Long, Term> entries = new HashMap<>();
    private final Deque<Term> reclaimable = new ArrayDeque<>();
    private Arena arena = new Arena(0L);
    private long garbageBytes;

    Shard(int index) {
        this.index = index;
    }

    int index() { return index; }

    Lock readLock() { return lock.readLock(); }

    Lock writeLock() { return lock.writeLock(); }

    // ---------- entry access (caller holds the lock) ----------

    /** Copy {@code value} into the current arena and store it under {@code key}. */
    void put(long key, Term value) {
        entries.put(key, arena.copyIn(value));
    }

    /** Current value for {@code key}, or null. */
    Term find(long key) {
        return entries.get(key);
    }

    /** Remove and return the value for {@code key}, or null. */
    Term erase(long key) {
        return entries.remove(key);
    }

    /** Queue a superseded value for accounting. O(1); frees nothing. */
    void reclaim(Term value) {
        reclaimable.addLast(value);
    }

    int size() {
        return entries.size();
    }

    void collectValues(List<Term> out) {
        out.addAll(entries.values());
    }

    // ---------- garbage accounting (caller holds the write lock) ----------

    /**
     * Pop up to {@code maxEntries} pending garbage values and add their estimated
     * size to the counter.
     *
     * @return the shard's garbage counter after tallying.
     */
    long tally(int maxEntries) {
        for (int i = 0; i < maxEntries; i++) {
            Term t = reclaimable.pollFirst();
            if (t == null) break;
            garbageBytes += t.estimatedBytes();
        }
        return garbageBytes;
    }

    /** Tallied garbage bytes. Needs at least the read lock. */
    long garbageBytes() {
        return garbageBytes;
    }

    /** Superseded values not yet tallied. Needs at least the read lock. */
    int pendingGarbage() {
        return reclaimable.size();
    }

    Arena arena() {
        return arena;
    }

    // ---------- epoch transitions (caller holds the write lock) ----------

    /**
     * Move every live value into a fresh arena and forget all garbage.
     * The retired arena is returned so the caller can release it after unlocking.
     */
    Compaction compact() {
        Arena old = arena;
        Arena fresh = old.successor();
        for (Map.Entry<Long, Term> e : entries.entrySet()) {
            e.setValue(fresh.copyIn(e.getValue()));
        }
        long reclaimedBytes = Math.max(0L, old.allocatedBytes() - fresh.allocatedBytes());
        long tallied = garbageBytes;

        arena = fresh;
        garbageBytes = 0L;
        reclaimable.clear();
        return new Compaction(old, reclaimedBytes, tallied);
    }

    /** Drop every entry and all garbage state; the arena is reset in place. */
    void clear() {
        entries.clear();
        reclaimable.clear();
        garbageBytes = 0L;
        arena.reset();
    }

    /** Final teardown: clear and release the arena. */
    void destroy() {
        entries.clear();
        reclaimable.clear();
        garbageBytes = 0L;
        arena.release();
    }

    /**
     * Outcome of one shard compaction.
     *
     * @param retired        arena to release once the shard lock is dropped.
     * @param reclaimedBytes arena bytes not carried over to the fresh arena.
     * @param talliedBytes   garbage counter value that was reset.
     */
    record Compaction(Arena retired, long reclaimedBytes, long talliedBytes) {}
}
