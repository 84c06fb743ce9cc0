// file: client/src/main/java/io/neural/client/Cli.java
package io.neural.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for interacting with a running NeuralTable server over HTTP.
 *
 * Values are JSON: numbers, strings, arrays, {"tuple": [...]} and {"bytes": "<base64>"}.
 * Keys are unsigned 64-bit integers.
 *
 * Examples:
 *   neural-cli create users 1
 *   neural-cli put users 42 '{"tuple": [42, "alice", []]}'
 *   neural-cli incr users 42 1 5
 *   neural-cli unshift users 42 3 '["a", "b"]'
 *   neural-cli drain users
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Command command = Command.parse(Arrays.asList(rest));
            new Cli(parsed.getKey()).execute(command);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(2);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            String[] rest = Arrays.copyOfRange(args, 2, args.length);
            return Map.entry(args[1], rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private void execute(Command command) throws IOException, InterruptedException {
        HttpRequest.BodyPublisher body = command.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(command.body()));

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + command.path()))
                .header("Content-Type", "application/json")
                .method(command.method(), body)
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        JsonNode reply = resp.body().isEmpty() ? null : json.readTree(resp.body());

        if (resp.statusCode() == 404 && reply != null && reply.has("found")) {
            System.out.println("(not found)");
            return;
        }
        if (resp.statusCode() >= 300) {
            throw new CliException(command.method() + " " + command.path()
                    + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(reply == null
                ? "OK"
                : json.writerWithDefaultPrettyPrinter().writeValueAsString(reply));
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage: neural-cli [--base-url http://host:port] <command> [args]

                Tables:
                  tables                                    list table names
                  create  <table> <keyPosition> [shards]
                  info    <table>                           key position, size, garbage, metrics
                  drop    <table>
                  empty   <table>
                  gc      <table>                           request a compaction pass
                  dump    <table>
                  drain   <table>

                Keys:
                  put     <table> <key> <json-value>
                  putnew  <table> <key> <json-value>        only if the key is absent
                  get     <table> <key>
                  del     <table> <key>
                  incr    <table> <key> <pos> <delta>       [<pos> <delta> ...]
                  unshift <table> <key> <pos> <json-array>  [<pos> <json-array> ...]
                  shift   <table> <key> <pos> <count>       [<pos> <count> ...] (count < 0: all)
                  swap    <table> <key> <pos> <json-value>  [<pos> <json-value> ...]

                  health
                """);
        System.exit(1);
    }
}
