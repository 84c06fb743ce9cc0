// file: engine/src/test/java/io/neural/engine/CompoundOpsTest.java
package io.neural.engine;

import io.neural.core.ErrorKind;
import io.neural.core.FieldTypeMismatchException;
import io.neural.core.IncrementOp;
import io.neural.core.InvalidFieldPositionException;
import io.neural.core.KeyAbsentException;
import io.neural.core.ShiftOp;
import io.neural.core.SwapOp;
import io.neural.core.Term;
import io.neural.core.UnshiftOp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Increment / unshift / shift / swap: results, field effects, and the
 * all-or-nothing rule when any op in a batch is rejected.
 */
class CompoundOpsTest {

    private static final Term A = Term.text("a");
    private static final Term B = Term.text("b");
    private static final Term C = Term.text("c");

    private NeuralTable table;

    @BeforeEach
    void open() {
        table = NeuralTable.open("compound", 1, TableOptions.defaults()
                .withShardCount(4)
                .withScanInterval(Duration.ofMillis(20)));
    }

    @AfterEach
    void close() {
        table.close();
    }

    // ---------- increment ----------

    @Test
    void increment_accumulates_on_same_field_in_op_order() {
        table.insert(1L, Term.tuple(Term.text("k"), Term.of(10)));

        List<Term> results = table.increment(1L, List.of(new IncrementOp(2, 5), new IncrementOp(2, -2)));

        assertEquals(List.of(Term.of(15), Term.of(13)), results);
        assertEquals(Term.of(13), field(1L, 2));
    }

    @Test
    void increment_on_real_field_stays_real() {
        table.insert(2L, Term.tuple(Term.of(1.5)));

        List<Term> results = table.increment(2L, List.of(new IncrementOp(1, 2)));

        assertEquals(List.of(Term.of(3.5)), results);
    }

    @Test
    void increment_with_bad_position_leaves_value_unchanged() {
        Term original = Term.tuple(Term.of(10), Term.of(20));
        table.insert(3L, original);

        var zero = assertThrows(InvalidFieldPositionException.class,
                () -> table.increment(3L, List.of(new IncrementOp(1, 1), new IncrementOp(0, 1))));
        assertEquals(ErrorKind.INVALID_FIELD_POSITION, zero.kind());
        assertEquals(0, zero.position());

        var past = assertThrows(InvalidFieldPositionException.class,
                () -> table.increment(3L, List.of(new IncrementOp(1, 1), new IncrementOp(3, 1))));
        assertEquals(2, past.arity());

        assertEquals(original, table.get(3L).orElseThrow());
    }

    @Test
    void increment_on_text_field_is_a_type_mismatch() {
        Term original = Term.tuple(Term.of(1), Term.text("name"));
        table.insert(4L, original);

        var ex = assertThrows(FieldTypeMismatchException.class,
                () -> table.increment(4L, List.of(new IncrementOp(1, 1), new IncrementOp(2, 1))));
        assertEquals(ErrorKind.FIELD_TYPE_MISMATCH, ex.kind());
        assertEquals(2, ex.position());
        assertEquals(original, table.get(4L).orElseThrow());
    }

    @Test
    void compound_ops_on_missing_key_report_key_absent() {
        var ex = assertThrows(KeyAbsentException.class,
                () -> table.increment(99L, List.of(new IncrementOp(1, 1))));
        assertEquals(ErrorKind.KEY_ABSENT, ex.kind());
        assertEquals(99L, ex.key());
        assertThrows(KeyAbsentException.class, () -> table.swap(99L, List.of(new SwapOp(1, A))));
        assertTrue(table.get(99L).isEmpty(), "a failed op never creates the key");
    }

    @Test
    void compound_ops_on_non_tuple_value_report_type_mismatch_at_position_zero() {
        table.insert(5L, Term.of(7));

        var ex = assertThrows(FieldTypeMismatchException.class,
                () -> table.increment(5L, List.of(new IncrementOp(1, 1))));
        assertEquals(0, ex.position());
        assertEquals(Term.of(7), table.get(5L).orElseThrow());
    }

    // ---------- unshift / shift ----------

    @Test
    void unshift_pushes_values_one_at_a_time_onto_the_head() {
        table.insert(10L, Term.tuple(Term.text("q"), Term.list()));

        List<Integer> lengths = table.unshift(10L, List.of(new UnshiftOp(2, List.of(A, B, C))));

        assertEquals(List.of(3), lengths);
        assertEquals(Term.list(C, B, A), field(10L, 2));
    }

    @Test
    void unshift_onto_non_list_fails_and_keeps_earlier_ops_uncommitted() {
        Term original = Term.tuple(Term.list(), Term.of(0));
        table.insert(11L, original);

        var ex = assertThrows(FieldTypeMismatchException.class, () -> table.unshift(11L, List.of(
                new UnshiftOp(1, List.of(A)),
                new UnshiftOp(2, List.of(B)))));
        assertEquals(2, ex.position());
        assertEquals(original, table.get(11L).orElseThrow());
    }

    @Test
    void shift_returns_popped_elements_most_recent_first_and_keeps_the_rest() {
        table.insert(12L, Term.tuple(Term.list(C, B, A)));

        List<List<Term>> popped = table.shift(12L, List.of(new ShiftOp(1, 2)));

        assertEquals(List.of(List.of(B, C)), popped);
        assertEquals(Term.list(A), field(12L, 1));
    }

    @Test
    void shift_with_negative_count_empties_the_list_and_zero_pops_nothing() {
        table.insert(13L, Term.tuple(Term.list(A, B), Term.list(C)));

        List<List<Term>> popped = table.shift(13L, List.of(new ShiftOp(2, 0), ShiftOp.all(1)));

        assertEquals(List.of(List.of(), List.of(B, A)), popped);
        assertEquals(Term.list(), field(13L, 1));
        assertEquals(Term.list(C), field(13L, 2));
    }

    @Test
    void shift_more_than_available_pops_what_is_there() {
        table.insert(14L, Term.tuple(Term.list(A)));

        assertEquals(List.of(List.of(A)), table.shift(14L, List.of(new ShiftOp(1, 10))));
        assertEquals(List.of(List.of()), table.shift(14L, List.of(new ShiftOp(1, 1))));
    }

    @Test
    void unshift_then_shift_in_one_table_round_trips_fifo_head() {
        table.insert(15L, Term.tuple(Term.list()));
        table.unshift(15L, List.of(new UnshiftOp(1, List.of(A))));
        table.unshift(15L, List.of(new UnshiftOp(1, List.of(B))));

        assertEquals(List.of(List.of(B)), table.shift(15L, List.of(new ShiftOp(1, 1))));
        assertEquals(Term.list(A), field(15L, 1));
    }

    // ---------- swap ----------

    @Test
    void swap_returns_prior_values_in_op_order() {
        table.insert(20L, Term.tuple(Term.of(1), Term.text("old")));

        List<Term> prior = table.swap(20L, List.of(new SwapOp(2, Term.text("new")), new SwapOp(1, Term.of(2))));

        assertEquals(List.of(Term.text("old"), Term.of(1)), prior);
        assertEquals(Term.tuple(Term.of(2), Term.text("new")), table.get(20L).orElseThrow());
    }

    @Test
    void swap_same_field_twice_returns_intermediate_value() {
        table.insert(21L, Term.tuple(A));

        List<Term> prior = table.swap(21L, List.of(new SwapOp(1, B), new SwapOp(1, C)));

        assertEquals(List.of(A, B), prior);
        assertEquals(Term.tuple(C), table.get(21L).orElseThrow());
    }

    // ---------- garbage ----------

    @Test
    void failed_compound_op_produces_no_garbage() throws Exception {
        table.insert(30L, Term.tuple(Term.of(1)));
        for (int i = 0; i < 10; i++) {
            assertThrows(InvalidFieldPositionException.class,
                    () -> table.increment(30L, List.of(new IncrementOp(1, 1), new IncrementOp(2, 1))));
        }
        // Give the scanner a few passes.
        Thread.sleep(150);
        assertEquals(0L, table.garbageSize());

        table.increment(30L, List.of(new IncrementOp(1, 1)));
        Await.until(Duration.ofSeconds(5), () -> table.garbageSize() == Term.WORD,
                "superseded Int tallied");
    }

    private Term field(long key, int position) {
        return ((Term.Tuple) table.get(key).orElseThrow()).field(position);
    }
}
