// file: core/src/main/java/io/neural/core/FieldTypeMismatchException.java
package io.neural.core;

/**
 * A compound op targeted a field (or a whole value) that does not have the
 * required shape, e.g. increment on a Text field or shift on a non-list.
 */
public final class FieldTypeMismatchException extends TableException {
    private final int position;

    public FieldTypeMismatchException(int position, String expected, Term actual) {
        super(ErrorKind.FIELD_TYPE_MISMATCH,
                "field %d: expected %s, found %s".formatted(position, expected, shapeOf(actual)));
        this.position = position;
    }

    /** Whole-value mismatch: compound operations need a tuple. */
    public static FieldTypeMismatchException notATuple(Term actual) {
        return new FieldTypeMismatchException(0, "tuple", actual);
    }

    /** 1-based field position, or 0 when the stored value itself has the wrong shape. */
    public int position() {
        return position;
    }

    private static String shapeOf(Term t) {
        return t == null ? "nothing" : t.getClass().getSimpleName().toLowerCase();
    }
}
