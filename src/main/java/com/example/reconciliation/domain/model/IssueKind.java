package com.example.reconciliation.domain.model;

/**
 * Row-level conditions that are recovered locally instead of failing the run.
 */
public enum IssueKind {
    MALFORMED_KEY("No 11-digit PartnerPin at the end of the key field"),
    UNPARSEABLE_AMOUNT("Amount field is not a number"),
    DIVISION_BY_ZERO("API rate is zero"),
    DUPLICATE_KEY_COLLISION("Several eligible records share this PartnerPin");

    private final String description;

    IssueKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * @return {@code true} when the affected row was dropped from the run
     */
    public boolean excludesRow() {
        return this != DUPLICATE_KEY_COLLISION;
    }
}
