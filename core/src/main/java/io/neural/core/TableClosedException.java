// file: core/src/main/java/io/neural/core/TableClosedException.java
package io.neural.core;

public final class TableClosedException extends TableException {

    public TableClosedException(String table) {
        super(ErrorKind.TABLE_CLOSED, "table is closed: " + table);
    }
}
