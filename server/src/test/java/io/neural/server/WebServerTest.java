// file: server/src/test/java/io/neural/server/WebServerTest.java
package io.neural.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.neural.engine.TableOptions;
import io.neural.engine.TableRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks of the HTTP surface against a started WebServer.
 *
 * Focus:
 *  - Table lifecycle and per-key routes.
 *  - Compound ops and their JSON results.
 *  - Dump / drain through the batch worker.
 *  - Error mapping: 400 / 404 / 405 / 409 / 413.
 */
class WebServerTest {

    private static final int PORT = 18090; // test-only port
    private static final String BASE = "http://localhost:" + PORT;

    private final ObjectMapper json = new ObjectMapper();
    private TableRegistry registry;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        registry = new TableRegistry(TableOptions.defaults().withShardCount(4));
        server = new WebServer(PORT, new TableService(registry));
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        registry.closeAll();
    }

    private HttpResponse<String> call(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = HttpRequest.newBuilder(URI.create(BASE + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode body(HttpResponse<String> resp) throws Exception {
        return json.readTree(resp.body());
    }

    private void createUsers() throws Exception {
        var resp = call("POST", "/tables", "{\"name\":\"users\",\"keyPosition\":1}");
        assertEquals(201, resp.statusCode(), resp.body());
    }

    @Test
    void health_endpoint_reports_ok() throws Exception {
        var resp = call("GET", "/admin/health", null);

        assertEquals(200, resp.statusCode());
        assertEquals("ok", body(resp).get("status").asText());
    }

    @Test
    void table_lifecycle_create_describe_list_destroy() throws Exception {
        var created = call("POST", "/tables", "{\"name\":\"users\",\"keyPosition\":2,\"shards\":8}");
        assertEquals(201, created.statusCode());
        assertEquals(8, body(created).get("shards").asInt());

        var described = call("GET", "/tables/users", null);
        assertEquals(200, described.statusCode());
        assertEquals(2, body(described).get("keyPosition").asInt());
        assertTrue(body(described).get("metrics").has("compactions"));

        assertEquals("users", body(call("GET", "/tables", null)).get("tables").get(0).asText());

        assertEquals(200, call("DELETE", "/tables/users", null).statusCode());
        assertEquals(404, call("GET", "/tables/users", null).statusCode());
    }

    @Test
    void duplicate_table_is_409() throws Exception {
        createUsers();

        var resp = call("POST", "/tables", "{\"name\":\"users\",\"keyPosition\":1}");

        assertEquals(409, resp.statusCode());
        assertEquals("TABLE_ALREADY_EXISTS", body(resp).get("error").asText());
    }

    @Test
    void put_get_delete_key() throws Exception {
        createUsers();

        var put = call("PUT", "/tables/users/keys/7", "{\"value\":{\"tuple\":[7,\"alice\"]}}");
        assertEquals(200, put.statusCode());
        assertTrue(body(put).get("previous").isNull());

        var get = call("GET", "/tables/users/keys/7", null);
        assertEquals(200, get.statusCode());
        assertEquals(json.readTree("{\"tuple\":[7,\"alice\"]}"), body(get).get("value"));

        var del = call("DELETE", "/tables/users/keys/7", null);
        assertTrue(body(del).get("deleted").asBoolean());

        var missing = call("GET", "/tables/users/keys/7", null);
        assertEquals(404, missing.statusCode());
        assertFalse(body(missing).get("found").asBoolean());
    }

    @Test
    void insert_new_does_not_overwrite() throws Exception {
        createUsers();

        assertTrue(body(call("POST", "/tables/users/keys/1/new", "{\"value\":1}")).get("inserted").asBoolean());
        assertFalse(body(call("POST", "/tables/users/keys/1/new", "{\"value\":2}")).get("inserted").asBoolean());
        assertEquals(1, body(call("GET", "/tables/users/keys/1", null)).get("value").asInt());
    }

    @Test
    void compound_ops_over_http() throws Exception {
        createUsers();
        call("PUT", "/tables/users/keys/1", "{\"value\":{\"tuple\":[10,[]]}}");

        var inc = call("POST", "/tables/users/keys/1/increment", "{\"ops\":[[1,5],[1,-2]]}");
        assertEquals(200, inc.statusCode(), inc.body());
        assertEquals(json.readTree("[15,13]"), body(inc).get("results"));

        var unshift = call("POST", "/tables/users/keys/1/unshift", "{\"ops\":[[2,[\"a\",\"b\",\"c\"]]]}");
        assertEquals(json.readTree("[3]"), body(unshift).get("lengths"));

        var shift = call("POST", "/tables/users/keys/1/shift", "{\"ops\":[[2,2]]}");
        assertEquals(json.readTree("[[\"b\",\"c\"]]"), body(shift).get("popped"));

        var swap = call("POST", "/tables/users/keys/1/swap", "{\"ops\":[[1,0]]}");
        assertEquals(json.readTree("[13]"), body(swap).get("previous"));
    }

    @Test
    void compound_op_errors_map_to_status_codes() throws Exception {
        createUsers();
        call("PUT", "/tables/users/keys/1", "{\"value\":{\"tuple\":[\"text\"]}}");

        var badPos = call("POST", "/tables/users/keys/1/increment", "{\"ops\":[[0,1]]}");
        assertEquals(400, badPos.statusCode());
        assertEquals("INVALID_FIELD_POSITION", body(badPos).get("error").asText());

        var mismatch = call("POST", "/tables/users/keys/1/increment", "{\"ops\":[[1,1]]}");
        assertEquals(400, mismatch.statusCode());
        assertEquals("FIELD_TYPE_MISMATCH", body(mismatch).get("error").asText());

        var absent = call("POST", "/tables/users/keys/2/increment", "{\"ops\":[[1,1]]}");
        assertEquals(404, absent.statusCode());
        assertEquals("KEY_ABSENT", body(absent).get("error").asText());

        var noTable = call("GET", "/tables/nope/keys/1", null);
        assertEquals(404, noTable.statusCode());
        assertEquals("TABLE_NOT_FOUND", body(noTable).get("error").asText());
    }

    @Test
    void dump_then_drain_then_empty_dump() throws Exception {
        createUsers();
        for (int k = 0; k < 5; k++) {
            call("PUT", "/tables/users/keys/" + k, "{\"value\":" + k + "}");
        }

        var dump = call("GET", "/tables/users/dump", null);
        assertEquals(200, dump.statusCode(), dump.body());
        assertEquals(5, body(dump).get("count").asInt());
        assertEquals("DUMP", body(dump).get("kind").asText());

        var drain = call("POST", "/tables/users/drain", null);
        assertEquals(5, body(drain).get("values").size());

        assertEquals(0, body(call("GET", "/tables/users/dump", null)).get("count").asInt());
    }

    @Test
    void empty_and_gc_routes() throws Exception {
        createUsers();
        call("PUT", "/tables/users/keys/1", "{\"value\":1}");

        assertEquals(200, call("POST", "/tables/users/empty", null).statusCode());
        assertEquals(0, body(call("GET", "/tables/users", null)).get("size").asInt());
        assertEquals(202, call("POST", "/tables/users/gc", null).statusCode());
    }

    @Test
    void validation_errors() throws Exception {
        createUsers();

        assertEquals(400, call("PUT", "/tables/users/keys/abc", "{\"value\":1}").statusCode());
        assertEquals(400, call("GET", "/tables/users/keys/", null).statusCode());

        var invalidJson = call("PUT", "/tables/users/keys/1", "{not json");
        assertEquals(400, invalidJson.statusCode());
        assertEquals("invalid JSON", body(invalidJson).get("error").asText());

        var nullValue = call("PUT", "/tables/users/keys/1", "{\"value\":null}");
        assertEquals(400, nullValue.statusCode());

        assertEquals(405, call("PATCH", "/tables/users/keys/1", "{}").statusCode());
        assertEquals(405, call("GET", "/tables/users/drain", null).statusCode());
        assertEquals(404, call("GET", "/nowhere", null).statusCode());
    }

    @Test
    void literal_null_body_is_400() throws Exception {
        createUsers();

        for (String path : new String[] {"/tables", "/tables/users/keys/1/new", "/tables/users/keys/1/increment"}) {
            var resp = call("POST", path, "null");
            assertEquals(400, resp.statusCode(), path + ": " + resp.body());
            assertEquals("request body must be an object", body(resp).get("error").asText());
        }
        var put = call("PUT", "/tables/users/keys/1", "null");
        assertEquals(400, put.statusCode(), put.body());
    }

    @Test
    void too_large_body_is_413() throws Exception {
        createUsers();
        String big = "{\"value\":\"" + "x".repeat(10 * 1024 * 1024 + 1) + "\"}";

        var resp = call("PUT", "/tables/users/keys/1", big);

        assertEquals(413, resp.statusCode());
        assertEquals("request body too large", body(resp).get("error").asText());
    }
}
