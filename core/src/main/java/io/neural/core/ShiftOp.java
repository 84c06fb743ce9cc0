// file: core/src/main/java/io/neural/core/ShiftOp.java
package io.neural.core;

/**
 * One step of a shift on the list at {@code position}.
 * <p>
 * count > 0 removes up to {@code count} head elements, count < 0 removes all of
 * them, count == 0 removes none.
 */
public record ShiftOp(int position, int count) {

    /** Shift that empties the whole list. */
    public static ShiftOp all(int position) {
        return new ShiftOp(position, -1);
    }
}
