// file: server/src/main/java/io/neural/server/dto/CreateTableRequest.java
package io.neural.server.dto;

/**
 * JSON body for POST /tables.
 * Example:
 *   {
 *     "name": "users",
 *     "keyPosition": 1,
 *     "shards": 32
 *   }
 * "shards" is optional; the server default applies when absent.
 */
public class CreateTableRequest {
    public String name;
    public int keyPosition;
    public Integer shards;
}
