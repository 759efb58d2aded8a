package com.example.reconciliation.domain.model;

/**
 * Identifies which of the two ledgers a table, record, or issue came from.
 */
public enum SourceType {
    STATEMENT("Statement"),
    SETTLEMENT("Settlement");

    private final String displayName;

    SourceType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
