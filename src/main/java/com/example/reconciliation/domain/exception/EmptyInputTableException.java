package com.example.reconciliation.domain.exception;

import com.example.reconciliation.domain.model.SourceType;

/**
 * Structural failure: a ledger has no header row or no data rows once the fixed header rows are stripped.
 * Fatal to the run.
 */
public class EmptyInputTableException extends DomainException {

	/**
	 * @param source    ledger that turned out empty
	 * @param tableName name of the uploaded table
	 */
    public EmptyInputTableException(SourceType source, String tableName) {
        super(source.displayName() + " file " + quote(tableName) + "contains no data rows.");
    }

    private static String quote(String tableName) {
        return tableName == null || tableName.isBlank() ? "" : "'" + tableName + "' ";
    }
}
