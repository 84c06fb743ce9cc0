// file: core/src/main/java/io/neural/core/TableNotFoundException.java
package io.neural.core;

public final class TableNotFoundException extends TableException {
    private final String table;

    public TableNotFoundException(String table) {
        super(ErrorKind.TABLE_NOT_FOUND, "table not found: " + table);
        this.table = table;
    }

    public String table() {
        return table;
    }
}
