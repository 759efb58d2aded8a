package com.example.reconciliation.domain.exception;

/**
 * Raised when a ledger path handed to the service does not exist on disk.
 */
public class TableNotFoundException extends DomainException {

    public TableNotFoundException(String path) {
        super("Ledger file not found: " + path);
    }
}
