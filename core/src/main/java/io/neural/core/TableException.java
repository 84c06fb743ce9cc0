// file: core/src/main/java/io/neural/core/TableException.java
package io.neural.core;

import java.util.Objects;

/**
 * Base class for all errors reported synchronously by table operations.
 * <p>
 * Errors are local: the engine never retries them, and a failed compound
 * operation leaves the stored value untouched.
 */
public class TableException extends RuntimeException {
    private final ErrorKind kind;

    public TableException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
