// file: core/src/main/java/io/neural/core/InvalidFieldPositionException.java
package io.neural.core;

/** A compound-op position outside [1, arity] of the stored value. */
public final class InvalidFieldPositionException extends TableException {
    private final int position;
    private final int arity;

    public InvalidFieldPositionException(int position, int arity) {
        super(ErrorKind.INVALID_FIELD_POSITION,
                "field position %d outside [1, %d]".formatted(position, arity));
        this.position = position;
        this.arity = arity;
    }

    public int position() {
        return position;
    }

    public int arity() {
        return arity;
    }
}
