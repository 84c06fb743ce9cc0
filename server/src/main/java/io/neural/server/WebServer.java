// file: server/src/main/java/io/neural/server/WebServer.java
package io.neural.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neural.core.TableException;
import io.neural.server.dto.CreateTableRequest;
import io.neural.server.dto.OpsRequest;
import io.neural.server.dto.ValueRequest;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP adapter over {@link TableService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map engine errors to HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout:
 *   - POST   /tables                              Create a table
 *   - GET    /tables                              List table names
 *   - GET    /tables/{t}                          Key position, size, garbage, metrics
 *   - DELETE /tables/{t}                          Destroy a table
 *   - PUT    /tables/{t}/keys/{k}                 Insert (overwrite)
 *   - GET    /tables/{t}/keys/{k}                 Get
 *   - DELETE /tables/{t}/keys/{k}                 Delete
 *   - POST   /tables/{t}/keys/{k}/new             Insert only if absent
 *   - POST   /tables/{t}/keys/{k}/increment       Compound ops, body {"ops": [[pos, arg], ...]}
 *   - POST   /tables/{t}/keys/{k}/unshift
 *   - POST   /tables/{t}/keys/{k}/shift
 *   - POST   /tables/{t}/keys/{k}/swap
 *   - POST   /tables/{t}/empty                    Remove every entry
 *   - POST   /tables/{t}/gc                       Request a compaction pass
 *   - GET    /tables/{t}/dump                     All values (batch job)
 *   - POST   /tables/{t}/drain                    All values, then clear (batch job)
 *   - GET    /admin/health                        Basic health check
 *
 * Keys are unsigned decimal 64-bit integers.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final TableService tables;

    public WebServer(int port, TableService tables) {
        this.tables = tables;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        String[] seg = path.length() > 1 ? path.substring(1).split("/", -1) : new String[0];

        if ("/admin/health".equals(path)) {
            send(ex, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
            return;
        }
        if (seg.length == 0 || !"tables".equals(seg[0])) {
            notFound(ex, method, path);
            return;
        }

        if (seg.length == 1) {
            switch (method) {
                case "POST" -> withBody(ex, body -> {
                    var req = readBody(body, CreateTableRequest.class);
                    return new Reply(201, tables.create(req));
                });
                case "GET" -> handle(ex, () -> new Reply(200, Map.of("tables", tables.names())));
                default -> methodNotAllowed(ex, method, path);
            }
            return;
        }

        String table = seg[1];
        if (table.isBlank()) {
            badRequest(ex, method, path, "table name must not be empty");
            return;
        }

        if (seg.length == 2) {
            switch (method) {
                case "GET" -> handle(ex, () -> new Reply(200, tables.describe(table)));
                // Closing a table waits for its workers; keep that off the IO thread.
                case "DELETE" -> blocking(ex, () -> {
                    tables.destroy(table);
                    return new Reply(200, Map.of("ok", true));
                });
                default -> methodNotAllowed(ex, method, path);
            }
        } else if (seg.length == 3) {
            routeTableOp(ex, method, path, table, seg[2]);
        } else if ("keys".equals(seg[2]) && (seg.length == 4 || seg.length == 5)) {
            String key = seg[3];
            if (key.isBlank()) {
                badRequest(ex, method, path, "key must not be empty");
            } else if (seg.length == 4) {
                routeKey(ex, method, path, table, key);
            } else {
                routeCompound(ex, method, path, table, key, seg[4]);
            }
        } else {
            notFound(ex, method, path);
        }
    }

    private void routeTableOp(HttpServerExchange ex, String method, String path, String table, String op) {
        switch (op + " " + method) {
            case "empty POST" -> handle(ex, () -> {
                tables.empty(table);
                return new Reply(200, Map.of("ok", true));
            });
            case "gc POST" -> handle(ex, () -> {
                tables.garbageCollect(table);
                return new Reply(202, Map.of("ok", true));
            });
            case "dump GET" -> blocking(ex, () -> new Reply(200, tables.dump(table)));
            case "drain POST" -> blocking(ex, () -> new Reply(200, tables.drain(table)));
            default -> {
                if (op.equals("empty") || op.equals("gc") || op.equals("dump") || op.equals("drain")) {
                    methodNotAllowed(ex, method, path);
                } else {
                    notFound(ex, method, path);
                }
            }
        }
    }

    private void routeKey(HttpServerExchange ex, String method, String path, String table, String key) {
        switch (method) {
            case "PUT" -> withBody(ex, body -> {
                var req = readBody(body, ValueRequest.class);
                ObjectNode out = json.createObjectNode();
                out.put("ok", true);
                out.set("previous", tables.insert(table, key, req.value).orElse(null));
                return new Reply(200, out);
            });
            case "GET" -> handle(ex, () -> {
                ObjectNode out = json.createObjectNode();
                var value = tables.get(table, key);
                out.put("found", value.isPresent());
                if (value.isEmpty()) {
                    return new Reply(404, out);
                }
                out.set("value", value.get());
                return new Reply(200, out);
            });
            case "DELETE" -> handle(ex, () -> {
                ObjectNode out = json.createObjectNode();
                var previous = tables.delete(table, key);
                out.put("deleted", previous.isPresent());
                out.set("previous", previous.orElse(null));
                return new Reply(200, out);
            });
            default -> methodNotAllowed(ex, method, path);
        }
    }

    private void routeCompound(HttpServerExchange ex, String method, String path,
                               String table, String key, String op) {
        if (!"POST".equals(method)) {
            methodNotAllowed(ex, method, path);
            return;
        }
        switch (op) {
            case "new" -> withBody(ex, body -> {
                var req = readBody(body, ValueRequest.class);
                return new Reply(200, Map.of("inserted", tables.insertNew(table, key, req.value)));
            });
            case "increment" -> withBody(ex, body -> {
                var req = readBody(body, OpsRequest.class);
                return new Reply(200, results("results", tables.increment(table, key, req.ops)));
            });
            case "unshift" -> withBody(ex, body -> {
                var req = readBody(body, OpsRequest.class);
                return new Reply(200, results("lengths", tables.unshift(table, key, req.ops)));
            });
            case "shift" -> withBody(ex, body -> {
                var req = readBody(body, OpsRequest.class);
                return new Reply(200, results("popped", tables.shift(table, key, req.ops)));
            });
            case "swap" -> withBody(ex, body -> {
                var req = readBody(body, OpsRequest.class);
                return new Reply(200, results("previous", tables.swap(table, key, req.ops)));
            });
            default -> notFound(ex, method, path);
        }
    }

    // ---------- request plumbing ----------

    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Reply run(byte[] body) throws Exception;
    }

    /** Run {@code action} and write its reply, or the mapped error. Logs either way. */
    private void handle(HttpServerExchange ex, Action action) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status = 500;
        long engineMs = -1L;
        Throwable error = null;
        try {
            long eStart = System.nanoTime();
            Reply reply = action.run();
            engineMs = (System.nanoTime() - eStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            status = 503;
            error = ie;
            send(ex, status, Map.of("error", "interrupted"));
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, engineMs, error);
        }
    }

    /** Read the full request body, then {@link #handle} it. */
    private void withBody(HttpServerExchange ex, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        send(exchange, 413, Map.of("error", "request body too large"));
                        RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                                exchange.getRequestPath(), 413, 0, -1, null);
                        return;
                    }
                    handle(exchange, () -> action.run(data));
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                            exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** Like {@link #handle}, but on a worker thread: the action may wait. */
    private void blocking(HttpServerExchange ex, Action action) {
        if (ex.isInIoThread()) {
            ex.dispatch(() -> handle(ex, action));
        } else {
            handle(ex, action);
        }
    }

    private void notFound(HttpServerExchange ex, String method, String path) {
        send(ex, 404, Map.of("error", "not found"));
        RequestLogger.logRequest(method, path, 404, 0, -1, null);
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    private void badRequest(HttpServerExchange ex, String method, String path, String message) {
        send(ex, 400, Map.of("error", message));
        RequestLogger.logRequest(method, path, 400, 0, -1, null);
    }

    // ---------- helpers ----------

    /** Bind a JSON body to {@code type}; a literal {@code null} body is rejected. */
    private <T> T readBody(byte[] body, Class<T> type) throws IOException {
        T value = json.readValue(body, type);
        if (value == null) {
            throw new IllegalArgumentException("request body must be an object");
        }
        return value;
    }

    /**
     * HTTP status for a failure:
     *   TABLE_NOT_FOUND, KEY_ABSENT                      -> 404
     *   TABLE_ALREADY_EXISTS                             -> 409
     *   INVALID_FIELD_POSITION, FIELD_TYPE_MISMATCH,
     *   IllegalArgumentException, malformed JSON         -> 400
     *   TABLE_CLOSED                                     -> 410
     *   dump reply timeout                               -> 504
     *   anything else                                    -> 500
     */
    static int statusFor(Throwable e) {
        if (e instanceof TableException te) {
            return switch (te.kind()) {
                case TABLE_NOT_FOUND, KEY_ABSENT -> 404;
                case TABLE_ALREADY_EXISTS -> 409;
                case INVALID_FIELD_POSITION, FIELD_TYPE_MISMATCH -> 400;
                case TABLE_CLOSED -> 410;
            };
        }
        if (e instanceof IllegalArgumentException || e instanceof JsonProcessingException) {
            return 400;
        }
        if (e instanceof TimeoutException) {
            return 504;
        }
        return 500;
    }

    private static Map<String, Object> errorBody(Throwable e) {
        if (e instanceof TableException te) {
            return Map.of("error", te.kind().name(), "message", String.valueOf(te.getMessage()));
        }
        if (e instanceof JsonProcessingException) {
            return Map.of("error", "invalid JSON");
        }
        if (e instanceof IllegalArgumentException) {
            return Map.of("error", String.valueOf(e.getMessage()));
        }
        return Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()));
    }

    private ObjectNode results(String field, JsonNode values) {
        ObjectNode out = json.createObjectNode();
        out.set(field, values);
        return out;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
