// file: server/src/main/java/io/neural/server/dto/ValueRequest.java
package io.neural.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for PUT /tables/{t}/keys/{k} and POST /tables/{t}/keys/{k}/new.
 * Example:
 *   {
 *     "value": { "tuple": [1, "alice", []] }
 *   }
 */
public class ValueRequest {
    public JsonNode value;
}
