package com.e2eq.datatable.exceptions;

/**
 * Raised when a CSV export is aborted. Nothing has been delivered to the download sink when this is thrown.
 */
public class TableExportException extends DataTableException {
    protected String filename;
    protected int rowNumber = -1;

    public TableExportException(String message, String filename) {
        super(message);
        this.filename = filename;
    }

    public TableExportException(String message, String filename, Throwable cause) {
        super(message, cause);
        this.filename = filename;
    }

    public TableExportException(String message, String filename, int rowNumber, Throwable cause) {
        super(message, cause);
        this.filename = filename;
        this.rowNumber = rowNumber;
    }

    public String getFilename() {
        return filename;
    }

    /**
     * @return the 1-based number of the data row that failed, or -1 when the failure is not tied to a row
     */
    public int getRowNumber() {
        return rowNumber;
    }
}
