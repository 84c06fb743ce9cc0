// file: server/src/main/java/io/neural/server/TablesConfig.java
package io.neural.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.neural.engine.TableRegistry;
import io.neural.server.dto.TablesJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Tables to create when the server starts.
 * <p>
 * File layout:
 * <pre>
 *   { "tables": [ { "name": "users", "keyPosition": 1, "shards": 32 } ] }
 * </pre>
 * "shards" is optional; the registry default applies when it is absent.
 */
public record TablesConfig(List<Table> tables) {
    private static final Logger log = Logger.getLogger(TablesConfig.class.getName());

    public record Table(String name, int keyPosition, Integer shards) {
        public Table {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
            if (shards != null && shards <= 0) throw new IllegalArgumentException("shards must be > 0");
        }
    }

    public TablesConfig {
        tables = List.copyOf(tables);
        long distinct = tables.stream().map(Table::name).distinct().count();
        if (distinct != tables.size()) {
            throw new IllegalArgumentException("duplicate table names in tables config");
        }
    }

    public static TablesConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            TablesJson cfg = mapper.readValue(path.toFile(), TablesJson.class);
            if (cfg.tables == null) {
                return new TablesConfig(List.of());
            }
            return new TablesConfig(cfg.tables.stream()
                    .map(t -> new Table(t.name, t.keyPosition, t.shards))
                    .toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load TablesConfig from " + path, e);
        }
    }

    /** Create every listed table in {@code registry}. */
    public void applyTo(TableRegistry registry) {
        for (Table t : tables) {
            var options = registry.defaults();
            if (t.shards() != null) {
                options = options.withShardCount(t.shards());
            }
            registry.create(t.name(), t.keyPosition(), options);
            log.info(() -> "bootstrapped table " + t.name());
        }
    }
}
