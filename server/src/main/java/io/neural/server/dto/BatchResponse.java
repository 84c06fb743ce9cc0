// file: server/src/main/java/io/neural/server/dto/BatchResponse.java
package io.neural.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON response for GET /tables/{t}/dump and POST /tables/{t}/drain.
 * Example:
 *   {
 *     "jobId": 7,
 *     "kind": "DRAIN",
 *     "count": 2,
 *     "values": [ {"tuple": [1, "a"]}, {"tuple": [2, "b"]} ]
 *   }
 */
public class BatchResponse {
    public long jobId;
    public String kind;
    public int count;
    public JsonNode values;
}
