// file: core/src/main/java/io/neural/core/UnshiftOp.java
package io.neural.core;

import java.util.List;

/**
 * One step of an unshift: push {@code values} one at a time onto the head of the
 * list at {@code position}. Pushing [a, b, c] onto [] yields [c, b, a].
 */
public record UnshiftOp(int position, List<Term> values) {
    public UnshiftOp {
        values = List.copyOf(values);
    }
}
