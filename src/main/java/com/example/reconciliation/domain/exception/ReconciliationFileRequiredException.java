package com.example.reconciliation.domain.exception;

import com.example.reconciliation.domain.model.SourceType;

/**
 * Raised when a reconciliation is requested without one of the two ledger files.
 */
public class ReconciliationFileRequiredException extends DomainException {

	/**
	 * @param source ledger whose file is missing or empty
	 */
    public ReconciliationFileRequiredException(SourceType source) {
        super("Please choose a " + source.displayName() + " file to upload.");
    }
}
