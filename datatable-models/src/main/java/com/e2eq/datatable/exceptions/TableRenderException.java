package com.e2eq.datatable.exceptions;

/**
 * Raised when a cell value cannot be read from a row by property name.
 */
public class TableRenderException extends RuntimeException {
    protected String columnKey;

    public TableRenderException(String message, String columnKey, Throwable cause) {
        super(message, cause);
        this.columnKey = columnKey;
    }

    public String getColumnKey() {
        return columnKey;
    }
}
