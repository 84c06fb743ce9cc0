// file: engine/src/main/java/io/neural/engine/JobKind.java
package io.neural.engine;

/** Whole-table operations handled by the batch worker. */
public enum JobKind {
    /** Non-destructive read of every value. */
    DUMP,
    /** Read every value and clear the table, atomically. */
    DRAIN
}
