// file: server/src/main/java/io/neural/server/dto/OpsRequest.java
package io.neural.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for the compound operations (increment, unshift, shift, swap).
 * Each op is a two-element array whose first element is the 1-based field position:
 *   { "ops": [[2, 5], [2, -2]] }              increment
 *   { "ops": [[3, ["a", "b"]]] }              unshift
 *   { "ops": [[3, 2]] }                       shift
 *   { "ops": [[2, "new"]] }                   swap
 */
public class OpsRequest {
    public JsonNode ops;
}
