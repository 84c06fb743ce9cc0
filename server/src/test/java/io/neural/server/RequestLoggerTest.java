// file: server/src/test/java/io/neural/server/RequestLoggerTest.java
package io.neural.server;

import io.neural.core.TableNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggerTest {

    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Logger logger = Logger.getLogger(RequestLogger.class.getName());
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        logger.addHandler(capture);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(capture);
    }

    @Test
    void success_line_reports_total_and_engine_latency() {
        RequestLogger.logRequest("GET", "/tables/users/keys/1", 200, 12, 3, null);

        LogRecord r = records.get(0);
        assertEquals(Level.INFO, r.getLevel());
        assertEquals("HTTP GET /tables/users/keys/1 -> 200 (total=12ms, engine=3ms)", r.getMessage());
    }

    @Test
    void unmeasured_engine_time_is_left_out() {
        RequestLogger.logRequest("GET", "/nowhere", 404, 0, -1, null);

        assertEquals("HTTP GET /nowhere -> 404 (total=0ms)", records.get(0).getMessage());
    }

    @Test
    void table_errors_name_their_kind_at_info() {
        RequestLogger.logRequest("GET", "/tables/ghost", 404, 1, 0, new TableNotFoundException("ghost"));

        LogRecord r = records.get(0);
        assertEquals(Level.INFO, r.getLevel());
        assertTrue(r.getMessage().contains("TABLE_NOT_FOUND"), r.getMessage());
        assertNull(r.getThrown());
    }

    @Test
    void server_errors_log_a_warning_with_the_cause() {
        var boom = new IllegalStateException("boom");
        RequestLogger.logRequest("POST", "/tables/users/drain", 500, 5, 4, boom);

        LogRecord r = records.get(0);
        assertEquals(Level.WARNING, r.getLevel());
        assertSame(boom, r.getThrown());
    }
}
