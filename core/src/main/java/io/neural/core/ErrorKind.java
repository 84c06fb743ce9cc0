// file: core/src/main/java/io/neural/core/ErrorKind.java
package io.neural.core;

/**
 * Error taxonomy surfaced by table operations. Every failure a caller can see
 * maps to exactly one kind.
 */
public enum ErrorKind {
    TABLE_NOT_FOUND,
    TABLE_ALREADY_EXISTS,
    INVALID_FIELD_POSITION,
    FIELD_TYPE_MISMATCH,
    KEY_ABSENT,
    /** Operation issued against a table that has been destroyed. */
    TABLE_CLOSED
}
