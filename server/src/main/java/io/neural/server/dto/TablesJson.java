// file: server/src/main/java/io/neural/server/dto/TablesJson.java
package io.neural.server.dto;

import java.util.List;

/** Bootstrap file layout read by {@code TablesConfig.fromJsonFile}. */
public class TablesJson {
    public List<Table> tables;

    public static class Table {
        public String name;
        public int keyPosition;
        public Integer shards;
    }
}
