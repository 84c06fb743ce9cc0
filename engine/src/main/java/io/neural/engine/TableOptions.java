// file: engine/src/main/java/io/neural/engine/TableOptions.java
package io.neural.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-table tuning knobs. Fixed for the life of a table.
 *
 * @param shardCount            number of shards N; key k lives in shard k mod N (unsigned).
 * @param reclaimThresholdBytes tallied garbage at which the GC worker compacts.
 * @param scanBatchSize         pending garbage values tallied per shard per scanner pass.
 * @param scanInterval          pause between scanner passes.
 */
public record TableOptions(
        int shardCount,
        long reclaimThresholdBytes,
        int scanBatchSize,
        Duration scanInterval
) {
    public static final int DEFAULT_SHARDS = 64;
    public static final long DEFAULT_RECLAIM_THRESHOLD = 1024L * 1024L; // 1 MiB
    public static final int DEFAULT_SCAN_BATCH = 5;
    public static final Duration DEFAULT_SCAN_INTERVAL = Duration.ofMillis(50);

    public TableOptions {
        Objects.requireNonNull(scanInterval, "scanInterval");
        if (shardCount <= 0) throw new IllegalArgumentException("shardCount must be > 0");
        if (reclaimThresholdBytes <= 0) throw new IllegalArgumentException("reclaimThresholdBytes must be > 0");
        if (scanBatchSize <= 0) throw new IllegalArgumentException("scanBatchSize must be > 0");
        if (scanInterval.isNegative() || scanInterval.isZero()) {
            throw new IllegalArgumentException("scanInterval must be positive, got: " + scanInterval);
        }
    }

    public static TableOptions defaults() {
        return new TableOptions(DEFAULT_SHARDS, DEFAULT_RECLAIM_THRESHOLD, DEFAULT_SCAN_BATCH, DEFAULT_SCAN_INTERVAL);
    }

    public TableOptions withShardCount(int n) {
        return new TableOptions(n, reclaimThresholdBytes, scanBatchSize, scanInterval);
    }

    public TableOptions withReclaimThreshold(long bytes) {
        return new TableOptions(shardCount, bytes, scanBatchSize, scanInterval);
    }

    public TableOptions withScanBatchSize(int size) {
        return new TableOptions(shardCount, reclaimThresholdBytes, size, scanInterval);
    }

    public TableOptions withScanInterval(Duration interval) {
        return new TableOptions(shardCount, reclaimThresholdBytes, scanBatchSize, interval);
    }
}
