// file: core/src/main/java/io/neural/core/Term.java
package io.neural.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable value stored in a neural table.
 * <p>
 * Shapes:
 *  - Int / Real: numeric fields (the only shapes {@code increment} accepts).
 *  - Text / Bytes: opaque payloads.
 *  - ListTerm: ordered list, head at index 0 (target of unshift / shift).
 *  - Tuple: fixed-arity record; positions are 1-based. Compound operations
 *    require the stored value to be a Tuple.
 * <p>
 * Invariants:
 *  - Terms are never mutated in place; every edit builds a new term.
 *  - Containers hold no null elements.
 */
public sealed interface Term
        permits Term.Int, Term.Real, Term.Text, Term.Bytes, Term.ListTerm, Term.Tuple {

    /** Machine word used by the footprint estimate. */
    long WORD = 8L;

    /**
     * Rough heap footprint of this term, including nested terms.
     * Used for garbage accounting only; it is deterministic, not exact.
     */
    long estimatedBytes();

    /** Structural copy. Scalars backed by immutable JDK types return {@code this}. */
    Term deepCopy();

    // ---------- factories ----------

    static Int of(long value) { return new Int(value); }

    static Real of(double value) { return new Real(value); }

    static Text text(String value) { return new Text(value); }

    static Bytes bytes(byte[] value) { return new Bytes(value); }

    static ListTerm list(Term... items) { return new ListTerm(List.of(items)); }

    static ListTerm list(List<? extends Term> items) { return new ListTerm(List.copyOf(items)); }

    static Tuple tuple(Term... fields) { return new Tuple(List.of(fields)); }

    // ---------- shapes ----------

    record Int(long value) implements Term {
        @Override public long estimatedBytes() { return WORD; }
        @Override public Term deepCopy() { return this; }
        @Override public String toString() { return Long.toString(value); }
    }

    record Real(double value) implements Term {
        @Override public long estimatedBytes() { return 2 * WORD; }
        @Override public Term deepCopy() { return this; }
        @Override public String toString() { return Double.toString(value); }
    }

    record Text(String value) implements Term {
        public Text {
            Objects.requireNonNull(value, "value");
        }
        @Override public long estimatedBytes() { return 2 * WORD + 2L * value.length(); }
        @Override public Term deepCopy() { return this; }
        @Override public String toString() { return '"' + value + '"'; }
    }

    /**
     * Binary payload. Defensive copies are taken on input and output, so
     * equality is by content.
     */
    record Bytes(byte[] value) implements Term {
        public Bytes {
            Objects.requireNonNull(value, "value");
            value = Arrays.copyOf(value, value.length);
        }

        @Override public byte[] value() { return Arrays.copyOf(value, value.length); }

        public int length() { return value.length; }

        @Override public long estimatedBytes() { return 2 * WORD + value.length; }

        @Override public Term deepCopy() { return new Bytes(value); }

        @Override public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override public int hashCode() { return Arrays.hashCode(value); }

        @Override public String toString() { return "<<" + value.length + " bytes>>"; }
    }

    /** Ordered list; one cons cell (two words) per element in the estimate. */
    record ListTerm(List<Term> items) implements Term {
        public ListTerm {
            items = List.copyOf(items);
        }

        public int size() { return items.size(); }

        public boolean isEmpty() { return items.isEmpty(); }

        @Override public long estimatedBytes() {
            long total = 0L;
            for (Term t : items) {
                total += 2 * WORD + t.estimatedBytes();
            }
            return total;
        }

        @Override public Term deepCopy() {
            List<Term> copy = new ArrayList<>(items.size());
            for (Term t : items) {
                copy.add(t.deepCopy());
            }
            return new ListTerm(copy);
        }

        @Override public String toString() { return items.toString(); }
    }

    /** Fixed-arity record. Positions passed to {@link #field(int)} are 1-based. */
    record Tuple(List<Term> fields) implements Term {
        public Tuple {
            fields = List.copyOf(fields);
        }

        public int arity() { return fields.size(); }

        public Term field(int position) {
            if (position < 1 || position > fields.size()) {
                throw new InvalidFieldPositionException(position, fields.size());
            }
            return fields.get(position - 1);
        }

        @Override public long estimatedBytes() {
            long total = WORD;
            for (Term t : fields) {
                total += WORD + t.estimatedBytes();
            }
            return total;
        }

        @Override public Term deepCopy() {
            List<Term> copy = new ArrayList<>(fields.size());
            for (Term t : fields) {
                copy.add(t.deepCopy());
            }
            return new Tuple(copy);
        }

        @Override public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(fields.get(i));
            }
            return sb.append('}').toString();
        }
    }
}
