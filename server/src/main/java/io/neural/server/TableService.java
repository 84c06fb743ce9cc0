// file: server/src/main/java/io/neural/server/TableService.java
package io.neural.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.neural.core.IncrementOp;
import io.neural.core.KeyHash;
import io.neural.core.ShiftOp;
import io.neural.core.SwapOp;
import io.neural.core.Term;
import io.neural.core.UnshiftOp;
import io.neural.engine.BatchResult;
import io.neural.engine.NeuralTable;
import io.neural.engine.ReplyChannel;
import io.neural.engine.TableOptions;
import io.neural.engine.TableRegistry;
import io.neural.server.dto.BatchResponse;
import io.neural.server.dto.CreateTableRequest;
import io.neural.server.dto.TableInfoResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Host-side facade over a {@link TableRegistry}.
 *
 * Responsibilities:
 *  - Resolve table names (unknown name -> TableNotFoundException).
 *  - Parse path keys as unsigned 64-bit integers.
 *  - Decode JSON values / op lists into engine types and encode results back.
 *  - Turn the engine's asynchronous dump / drain replies into a blocking call.
 *
 * Malformed input surfaces as IllegalArgumentException; engine failures are
 * passed through untouched so the web layer can map their ErrorKind.
 */
public final class TableService {
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final TableRegistry registry;
    private final Duration batchTimeout;

    public TableService(TableRegistry registry) {
        this(registry, Duration.ofSeconds(30));
    }

    public TableService(TableRegistry registry, Duration batchTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.batchTimeout = Objects.requireNonNull(batchTimeout, "batchTimeout");
    }

    public TableRegistry registry() {
        return registry;
    }

    // ---------- tables ----------

    public TableInfoResponse create(CreateTableRequest req) {
        if (req == null || req.name == null || req.name.isBlank()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        TableOptions options = registry.defaults();
        if (req.shards != null) {
            options = options.withShardCount(req.shards);
        }
        return describe(registry.create(req.name, req.keyPosition, options));
    }

    public TableInfoResponse describe(String table) {
        return describe(registry.require(table));
    }

    public List<String> names() {
        return List.copyOf(registry.names());
    }

    public void destroy(String table) {
        registry.destroy(table);
    }

    // ---------- keys ----------

    /** Insert; returns the previous value or empty. */
    public Optional<JsonNode> insert(String table, String rawKey, JsonNode value) {
        return registry.require(table)
                .insert(parseKey(rawKey), TermJson.toTerm(value))
                .map(TermJson::toJson);
    }

    public boolean insertNew(String table, String rawKey, JsonNode value) {
        return registry.require(table).insertNew(parseKey(rawKey), TermJson.toTerm(value));
    }

    public Optional<JsonNode> get(String table, String rawKey) {
        return registry.require(table).get(parseKey(rawKey)).map(TermJson::toJson);
    }

    /** Delete; returns the removed value or empty. */
    public Optional<JsonNode> delete(String table, String rawKey) {
        return registry.require(table).delete(parseKey(rawKey)).map(TermJson::toJson);
    }

    // ---------- compound operations ----------

    public ArrayNode increment(String table, String rawKey, JsonNode ops) {
        NeuralTable t = registry.require(table);
        return TermJson.toJsonArray(t.increment(parseKey(rawKey), incrementOps(ops)));
    }

    public ArrayNode unshift(String table, String rawKey, JsonNode ops) {
        NeuralTable t = registry.require(table);
        ArrayNode out = nodes.arrayNode();
        for (Integer len : t.unshift(parseKey(rawKey), unshiftOps(ops))) {
            out.add(len);
        }
        return out;
    }

    public ArrayNode shift(String table, String rawKey, JsonNode ops) {
        NeuralTable t = registry.require(table);
        ArrayNode out = nodes.arrayNode();
        for (List<Term> popped : t.shift(parseKey(rawKey), shiftOps(ops))) {
            out.add(TermJson.toJsonArray(popped));
        }
        return out;
    }

    public ArrayNode swap(String table, String rawKey, JsonNode ops) {
        NeuralTable t = registry.require(table);
        return TermJson.toJsonArray(t.swap(parseKey(rawKey), swapOps(ops)));
    }

    // ---------- whole-table operations ----------

    public void empty(String table) {
        registry.require(table).empty();
    }

    public void garbageCollect(String table) {
        registry.require(table).garbageCollect();
    }

    /**
     * Queue a dump and wait for its reply.
     *
     * @throws TimeoutException if the batch worker does not answer within the batch timeout.
     */
    public BatchResponse dump(String table) throws InterruptedException, TimeoutException {
        ReplyChannel reply = new ReplyChannel();
        registry.require(table).dump(reply);
        return toResponse(reply.receive(batchTimeout));
    }

    /**
     * Queue a drain and wait for its reply.
     * <p>
     * Unlike dump there is no timeout: once queued, the drain clears the table
     * whether or not anyone is still waiting, so the caller waits until the
     * values arrive. A reply always comes, since closing the table fails every
     * queued job with TABLE_CLOSED.
     */
    public BatchResponse drain(String table) {
        ReplyChannel reply = new ReplyChannel();
        registry.require(table).drain(reply);
        return toResponse(reply.receiveUninterruptibly());
    }

    // ---------- parsing helpers ----------

    static long parseKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        return KeyHash.parseUnsigned(rawKey);
    }

    static List<IncrementOp> incrementOps(JsonNode ops) {
        List<IncrementOp> out = new ArrayList<>();
        for (JsonNode op : pairs(ops)) {
            out.add(new IncrementOp(position(op), longArg(op.get(1), "delta")));
        }
        return out;
    }

    static List<UnshiftOp> unshiftOps(JsonNode ops) {
        List<UnshiftOp> out = new ArrayList<>();
        for (JsonNode op : pairs(ops)) {
            if (!op.get(1).isArray()) {
                throw new IllegalArgumentException("unshift values must be an array: " + op);
            }
            out.add(new UnshiftOp(position(op), TermJson.toTerms(op.get(1))));
        }
        return out;
    }

    static List<ShiftOp> shiftOps(JsonNode ops) {
        List<ShiftOp> out = new ArrayList<>();
        for (JsonNode op : pairs(ops)) {
            long count = longArg(op.get(1), "count");
            if (count < Integer.MIN_VALUE || count > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("shift count out of range: " + count);
            }
            out.add(new ShiftOp(position(op), (int) count));
        }
        return out;
    }

    static List<SwapOp> swapOps(JsonNode ops) {
        List<SwapOp> out = new ArrayList<>();
        for (JsonNode op : pairs(ops)) {
            out.add(new SwapOp(position(op), TermJson.toTerm(op.get(1))));
        }
        return out;
    }

    /** Validate the {@code [[pos, arg], ...]} shape shared by every op list. */
    private static List<JsonNode> pairs(JsonNode ops) {
        if (ops == null || !ops.isArray()) {
            throw new IllegalArgumentException("ops must be an array of [position, argument] pairs");
        }
        List<JsonNode> out = new ArrayList<>(ops.size());
        Iterator<JsonNode> it = ops.elements();
        while (it.hasNext()) {
            JsonNode op = it.next();
            if (!op.isArray() || op.size() != 2) {
                throw new IllegalArgumentException("op must be a [position, argument] pair: " + op);
            }
            out.add(op);
        }
        return out;
    }

    private static int position(JsonNode op) {
        JsonNode pos = op.get(0);
        if (!pos.isIntegralNumber() || !pos.canConvertToInt()) {
            throw new IllegalArgumentException("position must be an integer: " + pos);
        }
        return pos.intValue();
    }

    private static long longArg(JsonNode n, String what) {
        if (!n.isIntegralNumber() || !n.canConvertToLong()) {
            throw new IllegalArgumentException(what + " must be an integer: " + n);
        }
        return n.longValue();
    }

    private static TableInfoResponse describe(NeuralTable t) {
        var dto = new TableInfoResponse();
        dto.name = t.name();
        dto.keyPosition = t.keyPosition();
        dto.shards = t.shardCount();
        dto.size = t.size();
        dto.garbageBytes = t.garbageSize();
        dto.metrics = t.metrics();
        dto.gcFailure = t.gcFailure().map(Throwable::toString).orElse(null);
        return dto;
    }

    private static BatchResponse toResponse(BatchResult result) {
        var dto = new BatchResponse();
        dto.jobId = result.jobId();
        dto.kind = result.kind().name();
        dto.count = result.values().size();
        dto.values = TermJson.toJsonArray(result.values());
        return dto;
    }
}
