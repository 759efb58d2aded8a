package com.example.reconciliation.infrastructure.exception;

/**
 * Signals that an uploaded ledger could not be read or parsed as CSV or as an Excel workbook.
 */
public class TableReadException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level I/O, OpenCSV or POI exception
	 */
    public TableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
