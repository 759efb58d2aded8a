package com.example.reconciliation.domain.exception;

/**
 * Base type for failures raised by the reconciliation domain.
 * Subclasses describe bad inputs or broken matching rules and never wrap transport or I/O details.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule or input was violated
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule or input was violated
	 * @param cause   original exception that triggered the failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
