package com.example.reconciliation.domain.model;

/**
 * A row-level problem found while normalizing or matching.
 *
 * @param source    ledger the row belongs to
 * @param rowNumber 1-based row number in the uploaded file
 * @param kind      what went wrong
 * @param detail    offending value or extra context
 */
public record RowIssue(SourceType source, int rowNumber, IssueKind kind, String detail) {
}
