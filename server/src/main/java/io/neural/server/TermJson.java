// file: server/src/main/java/io/neural/server/TermJson.java
package io.neural.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.neural.core.Term;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON <-> Term mapping used by the HTTP layer.
 *
 * Encoding:
 *  - integral number            -> Int (must fit in a signed 64-bit long)
 *  - fractional number          -> Real
 *  - string                     -> Text
 *  - array                      -> ListTerm
 *  - {"tuple": [ ... ]}         -> Tuple
 *  - {"bytes": "<base64>"}      -> Bytes
 *
 * Anything else (null, booleans, other objects) is rejected with
 * IllegalArgumentException, which the web layer maps to HTTP 400.
 */
public final class TermJson {
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private TermJson() {
        // utility
    }

    public static Term toTerm(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new IllegalArgumentException("integer out of 64-bit range: " + node.asText());
            }
            return Term.of(node.longValue());
        }
        if (node.isNumber()) {
            return Term.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Term.text(node.textValue());
        }
        if (node.isArray()) {
            return Term.list(toTerms(node));
        }
        if (node.isObject() && node.size() == 1) {
            Map.Entry<String, JsonNode> only = node.fields().next();
            switch (only.getKey()) {
                case "tuple" -> {
                    if (!only.getValue().isArray()) {
                        throw new IllegalArgumentException("\"tuple\" must be an array");
                    }
                    return new Term.Tuple(toTerms(only.getValue()));
                }
                case "bytes" -> {
                    if (!only.getValue().isTextual()) {
                        throw new IllegalArgumentException("\"bytes\" must be a base64 string");
                    }
                    return Term.bytes(Base64.getDecoder().decode(only.getValue().textValue()));
                }
                default -> {
                    // fall through to the error below
                }
            }
        }
        throw new IllegalArgumentException("unsupported value: " + node);
    }

    public static List<Term> toTerms(JsonNode array) {
        List<Term> out = new ArrayList<>(array.size());
        Iterator<JsonNode> it = array.elements();
        while (it.hasNext()) {
            out.add(toTerm(it.next()));
        }
        return out;
    }

    public static JsonNode toJson(Term term) {
        if (term instanceof Term.Int i) {
            long v = i.value();
            // int-sized values as IntNode, matching what the parser produces
            return (v == (int) v) ? nodes.numberNode((int) v) : nodes.numberNode(v);
        } else if (term instanceof Term.Real r) {
            return nodes.numberNode(r.value());
        } else if (term instanceof Term.Text t) {
            return nodes.textNode(t.value());
        } else if (term instanceof Term.Bytes b) {
            ObjectNode obj = nodes.objectNode();
            obj.put("bytes", Base64.getEncoder().encodeToString(b.value()));
            return obj;
        } else if (term instanceof Term.ListTerm l) {
            return toJsonArray(l.items());
        } else if (term instanceof Term.Tuple t) {
            ObjectNode obj = nodes.objectNode();
            obj.set("tuple", toJsonArray(t.fields()));
            return obj;
        }
        throw new IllegalStateException("Unknown term type: " + term);
    }

    public static ArrayNode toJsonArray(List<? extends Term> terms) {
        ArrayNode arr = nodes.arrayNode(terms.size());
        for (Term t : terms) {
            arr.add(toJson(t));
        }
        return arr;
    }
}
