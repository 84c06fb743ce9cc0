// file: engine/src/main/java/io/neural/engine/NeuralTable.java
package io.neural.engine;

import io.neural.core.FieldTypeMismatchException;
import io.neural.core.IncrementOp;
import io.neural.core.InvalidFieldPositionException;
import io.neural.core.KeyAbsentException;
import io.neural.core.ShiftOp;
import io.neural.core.SwapOp;
import io.neural.core.TableClosedException;
import io.neural.core.Term;
import io.neural.core.UnshiftOp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * Concurrent sharded key -> value table.
 * <p>
 * Structure:
 *  - N shards fixed at construction; key k lives in shard {@code k mod N}
 *    (k read as unsigned 64-bit). Keys are expected to be pre-hashed.
 *  - Each shard has its own read/write lock. There is no table-wide lock for
 *    per-key operations, so different shards never contend.
 *  - Three background workers per table: reclamation scanner, GC worker, batch worker.
 * <p>
 * Per-key operations:
 *  - {@link #get} takes the shard lock shared; every mutation takes it exclusive
 *    and commits through a single put, so readers never see a half-applied update.
 *  - Compound operations (increment / unshift / shift / swap) edit a private copy
 *    of the stored tuple and commit once, after every op validated. Any error leaves
 *    the stored value, and the garbage list, untouched.
 * <p>
 * Whole-table operations:
 *  - {@link #empty()} locks every shard exclusively in index order.
 *  - {@link #dump} / {@link #drain} are queued on the batch worker and answered
 *    through a {@link Requester}. Dump locks one shard at a time (shared), so its
 *    result is a per-shard-consistent union, not a table-wide snapshot. Drain holds
 *    every shard exclusively for its whole duration, so no key is both drained and
 *    still visible afterwards.
 * <p>
 * Memory:
 *  - Superseded values go to their shard's garbage list. The scanner tallies them,
 *    and once a shard's tally crosses the reclaim threshold the GC worker copies live
 *    values into a fresh arena and drops the old one.
 */
public final class NeuralTable implements AutoCloseable {
    private static final Logger log = Logger.getLogger(NeuralTable.class.getName());

    private final String name;
    private final int keyPosition;
    private final TableOptions options;
    private final Shard[] shards;
    private final TableMetrics metrics = new TableMetrics();
    private final AtomicReference<Throwable> gcFailure = new AtomicReference<>();

    private final GarbageCollector gc;
    private final ReclamationScanner scanner;
    private final BatchWorker batch;

    private volatile boolean closed;

    private NeuralTable(String name, int keyPosition, TableOptions options) {
        this.name = Objects.requireNonNull(name, "name");
        this.keyPosition = keyPosition;
        this.options = Objects.requireNonNull(options, "options");
        this.shards = new Shard[options.shardCount()];
        for (int i = 0; i < shards.length; i++) {
            shards[i] = new Shard(i);
        }
        this.gc = new GarbageCollector(this, options);
        this.scanner = new ReclamationScanner(this, gc, options);
        this.batch = new BatchWorker(this);
    }

    /**
     * Build a table and start its background workers.
     *
     * @param name        table identity (unique within a registry).
     * @param keyPosition caller-defined metadata, stored and returned untouched.
     */
    public static NeuralTable open(String name, int keyPosition, TableOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        NeuralTable table = new NeuralTable(name, keyPosition, options);
        // GC first, so the scanner always has someone to wake.
        table.gc.start();
        table.scanner.start();
        table.batch.start();
        log.info(() -> "table %s opened (shards=%d, reclaimThreshold=%d bytes)"
                .formatted(name, options.shardCount(), options.reclaimThresholdBytes()));
        return table;
    }

    public static NeuralTable open(String name, int keyPosition) {
        return open(name, keyPosition, TableOptions.defaults());
    }

    // ---------- per-key operations ----------

    /**
     * Store {@code value} under {@code key}, overwriting.
     *
     * @return the previous value (now garbage), or empty if there was none.
     */
    public Optional<Term> insert(long key, Term value) {
        Objects.requireNonNull(value, "value");
        ensureOpen();
        Shard shard = shardFor(key);
        Lock w = shard.writeLock();
        w.lock();
        try {
            Term old = shard.find(key);
            if (old != null) {
                shard.reclaim(old);
            }
            shard.put(key, value);
            return Optional.ofNullable(old);
        } finally {
            w.unlock();
        }
    }

    /**
     * Store {@code value} only if {@code key} has no value.
     *
     * @return true if stored, false if a value already existed (left unchanged).
     */
    public boolean insertNew(long key, Term value) {
        Objects.requireNonNull(value, "value");
        ensureOpen();
        Shard shard = shardFor(key);
        Lock w = shard.writeLock();
        w.lock();
        try {
            if (shard.find(key) != null) {
                return false;
            }
            shard.put(key, value);
            return true;
        } finally {
            w.unlock();
        }
    }

    public Optional<Term> get(long key) {
        ensureOpen();
        Shard shard = shardFor(key);
        Lock r = shard.readLock();
        r.lock();
        try {
            return Optional.ofNullable(shard.find(key));
        } finally {
            r.unlock();
        }
    }

    /** Remove {@code key}; the removed value is returned and becomes garbage. */
    public Optional<Term> delete(long key) {
        ensureOpen();
        Shard shard = shardFor(key);
        Lock w = shard.writeLock();
        w.lock();
        try {
            Term old = shard.erase(key);
            if (old != null) {
                shard.reclaim(old);
            }
            return Optional.ofNullable(old);
        } finally {
            w.unlock();
        }
    }

    /**
     * Add each op's delta to its numeric field, in op order. Several ops may hit
     * the same field; they accumulate.
     *
     * @return the new field value produced by each op, in op order.
     * @throws KeyAbsentException             no value for key.
     * @throws InvalidFieldPositionException  a position outside [1, arity].
     * @throws FieldTypeMismatchException     a targeted field is not Int/Real, or the value is not a tuple.
     */
    public List<Term> increment(long key, List<IncrementOp> ops) {
        Objects.requireNonNull(ops, "ops");
        return compound(key, (fields, garbage) -> {
            List<Term> out = new ArrayList<>(ops.size());
            for (IncrementOp op : ops) {
                int slot = slot(op.position(), fields.length);
                Term current = fields[slot];
                Term next;
                if (current instanceof Term.Int i) {
                    next = Term.of(i.value() + op.delta());
                } else if (current instanceof Term.Real r) {
                    next = Term.of(r.value() + op.delta());
                } else {
                    throw new FieldTypeMismatchException(op.position(), "number", current);
                }
                garbage.add(current);
                fields[slot] = next;
                out.add(next);
            }
            return out;
        });
    }

    /**
     * Push each op's values onto the head of its list field, one at a time, so
     * [a, b, c] pushed onto [] yields [c, b, a].
     *
     * @return the resulting length of the touched list, per op, in op order.
     * @throws FieldTypeMismatchException the targeted field is not a list.
     */
    public List<Integer> unshift(long key, List<UnshiftOp> ops) {
        Objects.requireNonNull(ops, "ops");
        return compound(key, (fields, garbage) -> {
            List<Integer> out = new ArrayList<>(ops.size());
            for (UnshiftOp op : ops) {
                int slot = slot(op.position(), fields.length);
                Term.ListTerm list = listAt(fields, slot, op.position());
                List<Term> pushed = new ArrayList<>(op.values().size() + list.size());
                for (int i = op.values().size() - 1; i >= 0; i--) {
                    pushed.add(op.values().get(i));
                }
                pushed.addAll(list.items());
                fields[slot] = Term.list(pushed);
                out.add(pushed.size());
            }
            return out;
        });
    }

    /**
     * Pop elements from the head of list fields. count > 0 pops up to count,
     * count < 0 pops everything, 0 pops nothing.
     *
     * @return per op, the popped elements, most recently popped first.
     */
    public List<List<Term>> shift(long key, List<ShiftOp> ops) {
        Objects.requireNonNull(ops, "ops");
        return compound(key, (fields, garbage) -> {
            List<List<Term>> out = new ArrayList<>(ops.size());
            for (ShiftOp op : ops) {
                int slot = slot(op.position(), fields.length);
                Term.ListTerm list = listAt(fields, slot, op.position());
                int n = op.count() < 0 ? list.size() : Math.min(op.count(), list.size());

                List<Term> popped = new ArrayList<>(list.items().subList(0, n));
                garbage.addAll(popped);
                Collections.reverse(popped);

                fields[slot] = Term.list(list.items().subList(n, list.size()));
                out.add(List.copyOf(popped));
            }
            return out;
        });
    }

    /**
     * Replace fields with new values.
     *
     * @return the prior value of each targeted field, in op order.
     */
    public List<Term> swap(long key, List<SwapOp> ops) {
        Objects.requireNonNull(ops, "ops");
        return compound(key, (fields, garbage) -> {
            List<Term> out = new ArrayList<>(ops.size());
            for (SwapOp op : ops) {
                int slot = slot(op.position(), fields.length);
                Term prior = fields[slot];
                garbage.add(prior);
                out.add(prior);
                fields[slot] = op.value();
            }
            return out;
        });
    }

    // ---------- whole-table operations ----------

    /** Remove every entry and all garbage state, isolated from every per-key operation. */
    public void empty() {
        ensureOpen();
        lockAllExclusive();
        try {
            for (Shard s : shards) {
                s.clear();
            }
        } finally {
            unlockAllExclusive();
        }
        log.fine(() -> "table " + name + " emptied");
    }

    /** Queue a non-destructive read of every value; the payload goes to {@code requester}. */
    public BatchTicket dump(Requester requester) {
        Objects.requireNonNull(requester, "requester");
        ensureOpen();
        return batch.submit(JobKind.DUMP, requester);
    }

    /** Queue an atomic read-and-clear of the whole table; the payload goes to {@code requester}. */
    public BatchTicket drain(Requester requester) {
        Objects.requireNonNull(requester, "requester");
        ensureOpen();
        return batch.submit(JobKind.DRAIN, requester);
    }

    /**
     * Sum of every shard's tallied garbage. Each shard is read under its own shared
     * lock, so the total is an approximate, eventually consistent figure.
     */
    public long garbageSize() {
        long total = 0L;
        for (Shard s : shards) {
            Lock r = s.readLock();
            r.lock();
            try {
                total += s.garbageBytes();
            } finally {
                r.unlock();
            }
        }
        return total;
    }

    /** Ask the GC worker for a compaction pass now, below threshold or not. Returns immediately. */
    public void garbageCollect() {
        ensureOpen();
        gc.request();
    }

    /** Live entries across all shards; approximate under concurrent writes. */
    public int size() {
        int total = 0;
        for (Shard s : shards) {
            Lock r = s.readLock();
            r.lock();
            try {
                total += s.size();
            } finally {
                r.unlock();
            }
        }
        return total;
    }

    // ---------- accessors ----------

    public String name() { return name; }

    public int keyPosition() { return keyPosition; }

    public int shardCount() { return shards.length; }

    public TableOptions options() { return options; }

    public TableMetrics.Snapshot metrics() { return metrics.snapshot(); }

    /** Failure that stopped the GC worker, if any. */
    public Optional<Throwable> gcFailure() { return Optional.ofNullable(gcFailure.get()); }

    public boolean isClosed() { return closed; }

    /**
     * Stop the background workers (scanner and GC together, then the batch worker)
     * and release every shard. Callers must have quiesced per-key traffic first.
     * Queued batch jobs are failed with TABLE_CLOSED.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scanner.stop();
        gc.stop();
        batch.stop();

        lockAllExclusive();
        try {
            for (Shard s : shards) {
                s.destroy();
            }
        } finally {
            unlockAllExclusive();
        }
        log.info(() -> "table " + name + " closed");
    }

    // ---------- package-private hooks for workers ----------

    Shard shard(int index) {
        return shards[index];
    }

    int shardIndex(long key) {
        return (int) Long.remainderUnsigned(key, shards.length);
    }

    GarbageCollector garbageCollector() {
        return gc;
    }

    TableMetrics metricsSink() {
        return metrics;
    }

    void recordGcFailure(Throwable t) {
        gcFailure.compareAndSet(null, t);
    }

    /** Dump body: each shard under its own shared lock, one after the other. */
    List<Term> collectForDump() {
        List<Term> out = new ArrayList<>();
        for (Shard s : shards) {
            Lock r = s.readLock();
            r.lock();
            try {
                s.collectValues(out);
            } finally {
                r.unlock();
            }
        }
        return out;
    }

    /** Drain body: every shard held exclusively while collecting and clearing. */
    List<Term> collectForDrain() {
        List<Term> out = new ArrayList<>();
        lockAllExclusive();
        try {
            for (Shard s : shards) {
                s.collectValues(out);
                s.clear();
            }
        } finally {
            unlockAllExclusive();
        }
        return out;
    }

    // ---------- helpers ----------

    private Shard shardFor(long key) {
        return shards[shardIndex(key)];
    }

    private void ensureOpen() {
        if (closed) {
            throw new TableClosedException(name);
        }
    }

    /** Index order on the way in; reverse order on the way out. */
    private void lockAllExclusive() {
        for (Shard s : shards) {
            s.writeLock().lock();
        }
    }

    private void unlockAllExclusive() {
        for (int i = shards.length - 1; i >= 0; i--) {
            shards[i].writeLock().unlock();
        }
    }

    private static int slot(int position, int arity) {
        if (position < 1 || position > arity) {
            throw new InvalidFieldPositionException(position, arity);
        }
        return position - 1;
    }

    private static Term.ListTerm listAt(Term[] fields, int slot, int position) {
        if (fields[slot] instanceof Term.ListTerm list) {
            return list;
        }
        throw new FieldTypeMismatchException(position, "list", fields[slot]);
    }

    /**
     * Shared skeleton of the compound operations: lock, edit a copy of the tuple's
     * fields, commit once, then queue the superseded pieces as garbage.
     */
    private <R> R compound(long key, FieldEdit<R> edit) {
        ensureOpen();
        Shard shard = shardFor(key);
        Lock w = shard.writeLock();
        w.lock();
        try {
            Term current = shard.find(key);
            if (current == null) {
                throw new KeyAbsentException(name, key);
            }
            if (!(current instanceof Term.Tuple tuple)) {
                throw FieldTypeMismatchException.notATuple(current);
            }
            Term[] fields = tuple.fields().toArray(new Term[0]);
            List<Term> garbage = new ArrayList<>();

            R result = edit.apply(fields, garbage);

            shard.put(key, new Term.Tuple(Arrays.asList(fields)));
            for (Term t : garbage) {
                shard.reclaim(t);
            }
            return result;
        } finally {
            w.unlock();
        }
    }

    @FunctionalInterface
    private interface FieldEdit<R> {
        /** Mutate {@code fields} in place; add superseded terms to {@code garbage}. */
        R apply(Term[] fields, List<Term> garbage);
    }
}
