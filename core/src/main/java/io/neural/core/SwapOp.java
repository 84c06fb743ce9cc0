// file: core/src/main/java/io/neural/core/SwapOp.java
package io.neural.core;

import java.util.Objects;

/** Replace the field at {@code position} with {@code value}; the prior field is returned. */
public record SwapOp(int position, Term value) {
    public SwapOp {
        Objects.requireNonNull(value, "value");
    }
}
