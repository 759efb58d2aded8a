package com.example.reconciliation.application.exception;

/**
 * Signals a request the reconciliation use cases cannot act on.
 * Mapped to HTTP 400 unless a subclass says otherwise.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
