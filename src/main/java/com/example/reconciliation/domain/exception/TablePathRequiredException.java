package com.example.reconciliation.domain.exception;

import com.example.reconciliation.domain.model.SourceType;

/**
 * Raised when a caller runs a file-based reconciliation with a {@code null} path.
 */
public class TablePathRequiredException extends DomainException {

    public TablePathRequiredException(SourceType source) {
        super(source.displayName() + " file path is required.");
    }
}
