// file: server/src/main/java/io/neural/server/ServerConfig.java
package io.neural.server;

import io.neural.engine.TableOptions;

import java.time.Duration;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:              HTTP API port
 *  - tablesConfigPath:      optional JSON file listing tables to create at startup
 *  - shards:                default shard count for new tables
 *  - reclaimThresholdBytes: default tallied-garbage threshold that wakes the GC worker
 *  - scanIntervalMs:        default pause between reclamation scanner passes
 */
public record ServerConfig(
        int httpPort,
        String tablesConfigPath,
        int shards,
        long reclaimThresholdBytes,
        long scanIntervalMs
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --tables,    -t   <path>
     *   --shards,    -s   <count>
     *   --reclaim-threshold <bytes>
     *   --scan-interval-ms  <millis>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        int httpPort = 8080;
        String tablesConfigPath = null;
        int shards = TableOptions.DEFAULT_SHARDS;
        long reclaimThreshold = TableOptions.DEFAULT_RECLAIM_THRESHOLD;
        long scanIntervalMs = TableOptions.DEFAULT_SCAN_INTERVAL.toMillis();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseNumber(args[++i], "http-port");
                }

                case "--tables", "-t" -> {
                    ensureValue(args, i);
                    tablesConfigPath = args[++i];
                }

                case "--shards", "-s" -> {
                    ensureValue(args, i);
                    shards = (int) parseNumber(args[++i], "shards");
                }

                case "--reclaim-threshold" -> {
                    ensureValue(args, i);
                    reclaimThreshold = parseNumber(args[++i], "reclaim-threshold");
                }

                case "--scan-interval-ms" -> {
                    ensureValue(args, i);
                    scanIntervalMs = parseNumber(args[++i], "scan-interval-ms");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                httpPort,
                tablesConfigPath,
                shards,
                reclaimThreshold,
                scanIntervalMs
        );
    }

    /** Registry defaults for tables created by this server. */
    public TableOptions tableOptions() {
        return TableOptions.defaults()
                .withShardCount(shards)
                .withReclaimThreshold(reclaimThresholdBytes)
                .withScanInterval(Duration.ofMillis(scanIntervalMs));
    }

    private static long parseNumber(String raw, String option) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return -1L; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,      -p   HTTP port (default: 8080)
              --tables,         -t   Path to JSON file of tables to create at startup (optional)
              --shards,         -s   Default shard count for new tables (default: 64)
              --reclaim-threshold    Garbage bytes per shard that trigger compaction (default: 1048576)
              --scan-interval-ms     Pause between reclamation scans in ms (default: 50)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
