package com.example.reconciliation.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures (file I/O, CSV and workbook parsing).
 * Keeps library errors out of the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
