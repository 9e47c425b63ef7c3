package com.e2eq.datatable.exceptions;

public class DataTableException extends Exception {
    public DataTableException() {
        super();
    }

    public DataTableException(String message) {
        super(message);
    }

    public DataTableException(String message, Throwable cause) {
        super(message, cause);
    }

    public DataTableException(Throwable cause) {
        super(cause);
    }
}
