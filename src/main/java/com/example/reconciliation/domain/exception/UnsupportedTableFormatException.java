package com.example.reconciliation.domain.exception;

/**
 * Raised when an uploaded ledger is neither a CSV file nor an Excel workbook.
 */
public class UnsupportedTableFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedTableFormatException(String fileName) {
        super("Only CSV or Excel (.xlsx, .xls) uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
