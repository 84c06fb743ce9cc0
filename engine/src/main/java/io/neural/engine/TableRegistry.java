// file: engine/src/main/java/io/neural/engine/TableRegistry.java
package io.neural.engine;

import io.neural.core.TableAlreadyExistsException;
import io.neural.core.TableNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Name -> table mapping; the only way callers obtain a table.
 * <p>
 * Semantics:
 *  - create(): registers a new table and starts its workers; fails with
 *    TABLE_ALREADY_EXISTS if the name is taken. Creation and destruction are
 *    serialized on the registry, lookups are lock-free.
 *  - lookup(): never creates.
 *  - destroy(): unregisters and closes. Callers must stop issuing operations
 *    against the table first.
 * <p>
 * {@link #global()} is the process-wide instance; it starts empty and lives until
 * the JVM exits. Tests and embedders can use private instances instead.
 */
public final class TableRegistry {
    private static final Logger log = Logger.getLogger(TableRegistry.class.getName());

    private static final TableRegistry GLOBAL = new TableRegistry();

    private final Map<String, NeuralTable> tables = new ConcurrentHashMap<>();
    private final TableOptions defaults;

    public TableRegistry() {
        this(TableOptions.defaults());
    }

    /** @param defaults options for tables created without explicit options. */
    public TableRegistry(TableOptions defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public static TableRegistry global() {
        return GLOBAL;
    }

    public NeuralTable create(String name, int keyPosition) {
        return create(name, keyPosition, defaults);
    }

    public synchronized NeuralTable create(String name, int keyPosition, TableOptions options) {
        Objects.requireNonNull(name, "name");
        if (tables.containsKey(name)) {
            throw new TableAlreadyExistsException(name);
        }
        NeuralTable table = NeuralTable.open(name, keyPosition, options);
        tables.put(name, table);
        return table;
    }

    public Optional<NeuralTable> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(tables.get(name));
    }

    /** Like {@link #lookup} but fails with TABLE_NOT_FOUND. */
    public NeuralTable require(String name) {
        NeuralTable t = name == null ? null : tables.get(name);
        if (t == null) {
            throw new TableNotFoundException(name);
        }
        return t;
    }

    /** Unregister and close {@code name}. */
    public synchronized void destroy(String name) {
        NeuralTable t = tables.remove(name);
        if (t == null) {
            throw new TableNotFoundException(name);
        }
        t.close();
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(tables.keySet());
    }

    public TableOptions defaults() {
        return defaults;
    }

    /** Close and unregister every table; used at process shutdown. */
    public synchronized void closeAll() {
        List<String> names = new ArrayList<>(tables.keySet());
        for (String name : names) {
            NeuralTable t = tables.remove(name);
            if (t == null) continue;
            try {
                t.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "failed to close table " + name, e);
            }
        }
    }
}
