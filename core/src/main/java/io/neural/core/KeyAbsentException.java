// file: core/src/main/java/io/neural/core/KeyAbsentException.java
package io.neural.core;

/** The operation needs an existing value and the key has none. */
public final class KeyAbsentException extends TableException {
    private final long key;

    public KeyAbsentException(String table, long key) {
        super(ErrorKind.KEY_ABSENT, "no value for key %s in table %s"
                .formatted(Long.toUnsignedString(key), table));
        this.key = key;
    }

    public long key() {
        return key;
    }
}
