package com.example.reconciliation.domain.exception;

import com.example.reconciliation.domain.model.SourceType;

/**
 * Structural failure: the header row does not reach a column the layout maps. Fatal to the run.
 */
public class MissingColumnException extends DomainException {

    private final String column;

	/**
	 * @param source      ledger being normalized
	 * @param column      spreadsheet letter of the missing column
	 * @param headerWidth number of cells actually found in the header row
	 */
    public MissingColumnException(SourceType source, String column, int headerWidth) {
        super(source.displayName() + " file is missing column " + column
                + " (header row has " + headerWidth + " columns).");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
