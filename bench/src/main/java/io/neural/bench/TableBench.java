// file: bench/src/main/java/io/neural/bench/TableBench.java
package io.neural.bench;

import io.neural.core.IncrementOp;
import io.neural.core.KeyAbsentException;
import io.neural.core.ShiftOp;
import io.neural.core.Term;
import io.neural.core.UnshiftOp;
import io.neural.engine.NeuralTable;
import io.neural.engine.ReplyChannel;
import io.neural.engine.TableMetrics;
import io.neural.engine.TableOptions;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process workload driver for a single {@link NeuralTable}.
 *
 * Usage:
 *   java -cp bench.jar io.neural.bench.TableBench \
 *     --threads 8 \
 *     --duration-seconds 10 \
 *     --keyspace 100000 \
 *     --value-bytes 128 \
 *     --write-ratio 0.3 \
 *     --compound-ratio 0.3 \
 *     --zipf-skew 0.99 \
 *     --shards 64 \
 *     --sample-every 16
 *
 * Each op is one of GET, INSERT, INCREMENT or a paired UNSHIFT+SHIFT on a
 * per-key list. Values are tuples {counter, payload, list}.
 *
 * Output:
 *   - Summary (throughput, per-op percentiles, GC counters) to stderr.
 *   - CSV of sampled latencies to stdout: op,success,latency_us
 */
public final class TableBench {

    enum Op { GET, INSERT, INCREMENT, PUSH_POP }

    record Sample(Op op, boolean ok, double latencyUs) {}

    private TableBench() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "10"));
        int keyspace = Integer.parseInt(cfg.getOrDefault("keyspace", "100000"));
        int valueBytes = Integer.parseInt(cfg.getOrDefault("value-bytes", "128"));
        double writeRatio = Double.parseDouble(cfg.getOrDefault("write-ratio", "0.3"));
        double compoundRatio = Double.parseDouble(cfg.getOrDefault("compound-ratio", "0.3"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        int shards = Integer.parseInt(cfg.getOrDefault("shards", String.valueOf(TableOptions.DEFAULT_SHARDS)));
        int sampleEvery = Integer.parseInt(cfg.getOrDefault("sample-every", "16"));

        if (writeRatio + compoundRatio > 1.0) {
            throw new IllegalArgumentException("write-ratio + compound-ratio must be <= 1");
        }

        TableOptions options = TableOptions.defaults().withShardCount(shards);
        try (NeuralTable table = NeuralTable.open("bench", 1, options)) {
            runBenchmark(table, threads, durationSeconds, keyspace, valueBytes,
                    writeRatio, compoundRatio, zipfSkew, sampleEvery);
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void runBenchmark(
            NeuralTable table,
            int threads,
            int durationSeconds,
            int keyspace,
            int valueBytes,
            double writeRatio,
            double compoundRatio,
            double zipfSkew,
            int sampleEvery
    ) throws Exception {

        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(keyspace, zipfSkew);
        Term payload = Term.text("x".repeat(valueBytes));

        // Preload so compound ops find their tuples.
        for (int r = 0; r < zipf.size(); r++) {
            table.insert(zipf.keyAt(r), value(r, payload));
        }

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong opCount = new AtomicLong();
        AtomicLong errCount = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        for (int t = 0; t < threads; t++) {
            final long seed = 42L + t;
            exec.submit(() -> {
                Random rnd = new Random(seed);
                long n = 0;
                while (System.nanoTime() < endTime) {
                    double roll = rnd.nextDouble();
                    Op op = roll < writeRatio ? Op.INSERT
                            : roll < writeRatio + compoundRatio ? (rnd.nextBoolean() ? Op.INCREMENT : Op.PUSH_POP)
                            : Op.GET;
                    long key = zipf.next(rnd);

                    long start = System.nanoTime();
                    boolean ok = true;
                    try {
                        runOp(table, op, key, payload, rnd);
                    } catch (KeyAbsentException e) {
                        ok = false;
                        errCount.incrementAndGet();
                    }
                    if (++n % sampleEvery == 0) {
                        samples.add(new Sample(op, ok, (System.nanoTime() - start) / 1_000.0));
                    }
                    opCount.incrementAndGet();
                }
            });
        }
        exec.shutdown();
        exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS);

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);

        ReplyChannel reply = new ReplyChannel();
        table.dump(reply);
        int liveValues = reply.receive(Duration.ofSeconds(30)).values().size();

        summarizeAndPrint(all, opCount.get(), errCount.get(), durationSeconds, table.metrics(), liveValues);
    }

    private static Term value(int rank, Term payload) {
        return Term.tuple(Term.of(rank), payload, Term.list());
    }

    private static void runOp(NeuralTable table, Op op, long key, Term payload, Random rnd) {
        switch (op) {
            case GET -> table.get(key);
            case INSERT -> table.insert(key, Term.tuple(Term.of(rnd.nextInt(1000)), payload, Term.list()));
            case INCREMENT -> table.increment(key, List.of(new IncrementOp(1, 1)));
            case PUSH_POP -> {
                table.unshift(key, List.of(new UnshiftOp(3, List.of(Term.of(rnd.nextLong())))));
                table.shift(key, List.of(new ShiftOp(3, 1)));
            }
        }
    }

    private static void summarizeAndPrint(
            List<Sample> all,
            long totalOps,
            long errors,
            int durationSeconds,
            TableMetrics.Snapshot metrics,
            int liveValues
    ) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = totalOps / (double) durationSeconds;
        System.err.printf("throughput=%.2f ops/s, ops=%d, err=%d, live=%d%n",
                throughput, totalOps, errors, liveValues);

        Map<Op, List<Double>> byOp = new EnumMap<>(Op.class);
        for (Sample s : all) {
            if (s.ok()) {
                byOp.computeIfAbsent(s.op(), k -> new ArrayList<>()).add(s.latencyUs());
            }
        }
        for (Map.Entry<Op, List<Double>> e : byOp.entrySet()) {
            List<Double> latencies = e.getValue();
            Collections.sort(latencies);
            System.err.printf("  %-9s n=%d p50=%.1fus p95=%.1fus p99=%.1fus%n",
                    e.getKey(), latencies.size(),
                    percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99));
        }
        System.err.printf("gc: compactions=%d reclaimed=%d bytes tallied=%d bytes wakeups=%d%n",
                metrics.compactions(), metrics.bytesReclaimed(), metrics.garbageTallied(),
                metrics.thresholdWakeups());

        // CSV to stdout.
        System.out.println("op,success,latency_us");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op(), s.ok() ? "1" : "0", s.latencyUs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
