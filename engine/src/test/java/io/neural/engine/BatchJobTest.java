// file: engine/src/test/java/io/neural/engine/BatchJobTest.java
package io.neural.engine;

import io.neural.core.ErrorKind;
import io.neural.core.TableClosedException;
import io.neural.core.Term;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dump / drain through the batch worker: payloads, FIFO ordering of jobs, and
 * failure of jobs still queued when the table closes.
 */
class BatchJobTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private static NeuralTable openWith(String name, int keys) {
        NeuralTable table = NeuralTable.open(name, 1, TableOptions.defaults().withShardCount(8));
        for (long k = 0; k < keys; k++) {
            table.insert(k, Term.tuple(Term.of(k)));
        }
        return table;
    }

    private static Set<Term> expected(int keys) {
        Set<Term> out = new HashSet<>();
        for (long k = 0; k < keys; k++) {
            out.add(Term.tuple(Term.of(k)));
        }
        return out;
    }

    @Test
    void dump_returns_every_value_and_leaves_table_intact() throws Exception {
        try (NeuralTable table = openWith("dump", 100)) {
            ReplyChannel reply = new ReplyChannel();

            BatchTicket ticket = table.dump(reply);
            BatchResult result = reply.receive(WAIT);

            assertEquals(JobKind.DUMP, ticket.kind());
            assertEquals(ticket.jobId(), result.jobId());
            assertEquals(JobKind.DUMP, result.kind());
            assertEquals(100, result.values().size());
            assertEquals(expected(100), new HashSet<>(result.values()));
            assertEquals(100, table.size());
        }
    }

    @Test
    void drain_returns_every_value_and_empties_the_table() throws Exception {
        try (NeuralTable table = openWith("drain", 64)) {
            ReplyChannel reply = new ReplyChannel();

            table.drain(reply);
            BatchResult result = reply.receive(WAIT);

            assertEquals(JobKind.DRAIN, result.kind());
            assertEquals(expected(64), new HashSet<>(result.values()));
            assertEquals(0, table.size());
            assertEquals(0L, table.garbageSize());
            assertEquals(1L, table.metrics().drains());
        }
    }

    @Test
    void jobs_run_in_submission_order() throws Exception {
        try (NeuralTable table = openWith("fifo", 10)) {
            ReplyChannel reply = new ReplyChannel();

            BatchTicket first = table.dump(reply);
            BatchTicket second = table.drain(reply);
            BatchTicket third = table.dump(reply);

            assertTrue(first.jobId() < second.jobId() && second.jobId() < third.jobId());

            BatchResult r1 = reply.receive(WAIT);
            BatchResult r2 = reply.receive(WAIT);
            BatchResult r3 = reply.receive(WAIT);
            assertEquals(List.of(first.jobId(), second.jobId(), third.jobId()),
                    List.of(r1.jobId(), r2.jobId(), r3.jobId()));
            assertEquals(10, r1.values().size());
            assertEquals(10, r2.values().size());
            assertTrue(r3.values().isEmpty(), "dump after drain sees an empty table");
        }
    }

    @Test
    void empty_table_dump_is_an_empty_list() throws Exception {
        try (NeuralTable table = openWith("empty-dump", 0)) {
            ReplyChannel reply = new ReplyChannel();
            table.dump(reply);
            assertTrue(reply.receive(WAIT).values().isEmpty());
        }
    }

    @Test
    void queued_jobs_fail_with_table_closed_on_close() throws Exception {
        NeuralTable table = openWith("closing", 5);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);

        // Holds the worker inside send() until close() interrupts it.
        Requester stuck = new Requester() {
            @Override
            public void send(BatchResult result) {
                entered.countDown();
                try {
                    never.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void fail(long jobId, RuntimeException cause) {
            }
        };

        table.dump(stuck);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        ReplyChannel queued = new ReplyChannel();
        BatchTicket ticket = table.drain(queued);

        table.close();

        var ex = assertThrows(TableClosedException.class, () -> queued.receive(WAIT));
        assertEquals(ErrorKind.TABLE_CLOSED, ex.kind());
        assertEquals(0, queued.pending());
        assertTrue(ticket.jobId() > 0);
    }

    @Test
    void receive_times_out_when_nothing_arrives() {
        ReplyChannel reply = new ReplyChannel();
        assertThrows(TimeoutException.class, () -> reply.receive(Duration.ofMillis(20)));
    }

    @Test
    void jobs_report_their_kind_and_require_a_requester() {
        ReplyChannel reply = new ReplyChannel();

        assertEquals(JobKind.DUMP, new BatchJob.Dump(1L, reply).kind());
        assertEquals(JobKind.DRAIN, new BatchJob.Drain(2L, reply).kind());
        assertThrows(NullPointerException.class, () -> new BatchJob.Dump(3L, null));
        assertThrows(NullPointerException.class, () -> new BatchJob.Drain(4L, null));
    }

    @Test
    void receive_uninterruptibly_waits_through_an_interrupt() throws Exception {
        ReplyChannel reply = new ReplyChannel();
        BatchResult sent = new BatchResult(7L, JobKind.DRAIN, List.of(Term.of(1L)));
        Thread sender = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            reply.send(sent);
        });

        Thread.currentThread().interrupt();
        sender.start();
        BatchResult received = reply.receiveUninterruptibly();

        assertTrue(Thread.interrupted(), "interrupt status restored and cleared here");
        assertEquals(sent, received);
        sender.join();
    }
}
