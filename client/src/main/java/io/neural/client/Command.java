// file: client/src/main/java/io/neural/client/Command.java
package io.neural.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * One HTTP call derived from CLI words.
 *
 * @param method HTTP method
 * @param path   request path, starting with '/'
 * @param body   JSON body, or null for none
 */
record Command(String method, String path, JsonNode body) {
    private static final ObjectMapper json = new ObjectMapper();

    /**
     * Build the request for {@code words} = command name followed by its arguments.
     *
     * @throws CliException on unknown commands, wrong arity or unparseable arguments.
     */
    static Command parse(List<String> words) {
        if (words.isEmpty()) {
            throw new CliException("missing command");
        }
        String cmd = words.get(0);
        List<String> a = words.subList(1, words.size());

        switch (cmd) {
            case "health" -> {
                arity(cmd, a, 0, "");
                return new Command("GET", "/admin/health", null);
            }
            case "tables" -> {
                arity(cmd, a, 0, "");
                return new Command("GET", "/tables", null);
            }
            case "create" -> {
                if (a.size() != 2 && a.size() != 3) {
                    throw new CliException("create requires <table> <keyPosition> [shards]");
                }
                ObjectNode body = json.createObjectNode();
                body.put("name", a.get(0));
                body.put("keyPosition", integer(a.get(1), "keyPosition"));
                if (a.size() == 3) {
                    body.put("shards", integer(a.get(2), "shards"));
                }
                return new Command("POST", "/tables", body);
            }
            case "info" -> {
                arity(cmd, a, 1, "<table>");
                return new Command("GET", table(a), null);
            }
            case "drop" -> {
                arity(cmd, a, 1, "<table>");
                return new Command("DELETE", table(a), null);
            }
            case "put", "putnew" -> {
                arity(cmd, a, 3, "<table> <key> <json-value>");
                ObjectNode body = json.createObjectNode();
                body.set("value", value(a.get(2)));
                String path = key(a) + ("putnew".equals(cmd) ? "/new" : "");
                return new Command("putnew".equals(cmd) ? "POST" : "PUT", path, body);
            }
            case "get" -> {
                arity(cmd, a, 2, "<table> <key>");
                return new Command("GET", key(a), null);
            }
            case "del" -> {
                arity(cmd, a, 2, "<table> <key>");
                return new Command("DELETE", key(a), null);
            }
            case "incr" -> {
                return compound(cmd, a, "increment", "<pos> <delta>", arg -> {
                    long delta = Long.parseLong(arg);
                    return delta == (int) delta
                            ? json.getNodeFactory().numberNode((int) delta)
                            : json.getNodeFactory().numberNode(delta);
                });
            }
            case "unshift" -> {
                return compound(cmd, a, "unshift", "<pos> <json-array>", Command::value);
            }
            case "shift" -> {
                return compound(cmd, a, "shift", "<pos> <count>", arg -> json.getNodeFactory()
                        .numberNode(Integer.parseInt(arg)));
            }
            case "swap" -> {
                return compound(cmd, a, "swap", "<pos> <json-value>", Command::value);
            }
            case "empty", "gc", "drain" -> {
                arity(cmd, a, 1, "<table>");
                return new Command("POST", table(a) + "/" + cmd, null);
            }
            case "dump" -> {
                arity(cmd, a, 1, "<table>");
                return new Command("GET", table(a) + "/dump", null);
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    @FunctionalInterface
    private interface ArgParser {
        JsonNode parse(String arg);
    }

    /** {@code <table> <key> (<pos> <arg>)+} -> {"ops": [[pos, arg], ...]}. */
    private static Command compound(String cmd, List<String> a, String route, String pair, ArgParser parser) {
        if (a.size() < 4 || a.size() % 2 != 0) {
            throw new CliException(cmd + " requires <table> <key> " + pair + " [" + pair + " ...]");
        }
        ArrayNode ops = json.createArrayNode();
        for (int i = 2; i < a.size(); i += 2) {
            ArrayNode op = json.createArrayNode();
            op.add(integer(a.get(i), "pos"));
            try {
                op.add(parser.parse(a.get(i + 1)));
            } catch (NumberFormatException e) {
                throw new CliException("not a number: " + a.get(i + 1));
            }
            ops.add(op);
        }
        ObjectNode body = json.createObjectNode();
        body.set("ops", ops);
        return new Command("POST", key(a) + "/" + route, body);
    }

    private static void arity(String cmd, List<String> a, int n, String usage) {
        if (a.size() != n) {
            throw new CliException(n == 0 ? cmd + " takes no arguments" : cmd + " requires " + usage);
        }
    }

    private static String table(List<String> a) {
        return "/tables/" + a.get(0);
    }

    private static String key(List<String> a) {
        try {
            Long.parseUnsignedLong(a.get(1));
        } catch (NumberFormatException e) {
            throw new CliException("key must be an unsigned 64-bit integer: " + a.get(1));
        }
        return table(a) + "/keys/" + a.get(1);
    }

    private static int integer(String raw, String what) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be an integer: " + raw);
        }
    }

    private static JsonNode value(String raw) {
        try {
            return json.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CliException("invalid JSON value: " + raw);
        }
    }
}
