package com.example.reconciliation.application.exception;

/**
 * Thrown when the cached reconciliation result cannot be exported, e.g. nothing has been reconciled yet
 * or the selected classifications match no rows.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
