// file: core/src/main/java/io/neural/core/TableAlreadyExistsException.java
package io.neural.core;

public final class TableAlreadyExistsException extends TableException {
    private final String table;

    public TableAlreadyExistsException(String table) {
        super(ErrorKind.TABLE_ALREADY_EXISTS, "table already exists: " + table);
        this.table = table;
    }

    public String table() {
        return table;
    }
}
