// file: server/src/main/java/io/neural/server/dto/TableInfoResponse.java
package io.neural.server.dto;

import io.neural.engine.TableMetrics;

/**
 * JSON response for GET /tables/{t} and POST /tables.
 */
public class TableInfoResponse {
    public String name;
    public int keyPosition;
    public int shards;
    public int size;
    public long garbageBytes;
    public TableMetrics.Snapshot metrics;
    public String gcFailure;        // present only if the GC worker died
}
