// file: server/src/main/java/io/neural/server/RequestLogger.java
package io.neural.server;

import io.neural.core.TableException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request.
 * <p>
 * Two latencies are reported. {@code total} covers the whole exchange, including
 * body read and JSON encoding. {@code engine} covers only the call into
 * {@link TableService}: shard lock waits, the operation itself and, for dump and
 * drain, the time the job spent queued behind other batch jobs. A large gap between
 * the two points at the HTTP layer, a large engine time at lock contention or a
 * busy batch worker.
 * <p>
 * Levels: INFO below 500 (with the engine error kind when a table error caused the
 * reply), WARNING with the stack trace from 500 up.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param engineMillis time inside {@link TableService}, or -1 when the request
     *                     never reached it (routing errors, oversized bodies)
     * @param error        failure behind a 4xx/5xx reply, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            Throwable error
    ) {
        StringBuilder msg = new StringBuilder()
                .append("HTTP ").append(method).append(' ').append(path)
                .append(" -> ").append(status)
                .append(" (total=").append(totalMillis).append("ms");
        if (engineMillis >= 0) {
            msg.append(", engine=").append(engineMillis).append("ms");
        }
        msg.append(')');

        if (status >= 500) {
            log.log(Level.WARNING, msg.toString(), error);
            return;
        }
        if (error instanceof TableException te) {
            msg.append(' ').append(te.kind()).append(": ").append(te.getMessage());
        } else if (error != null) {
            msg.append(": ").append(error.getMessage());
        }
        log.info(msg.toString());
    }
}
