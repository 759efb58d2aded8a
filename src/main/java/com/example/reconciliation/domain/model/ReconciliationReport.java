package com.example.reconciliation.domain.model;

import java.util.List;

/**
 * Everything produced by one reconciliation run. Returned from {@code ReconciliationService}
 * and cached in the HTTP session so the result table can be exported later.
 */
public record ReconciliationReport(
        String statementFileName,
        String settlementFileName,
        List<ReconciliationResult> results,
        List<RowIssue> issues,
        ReconciliationSummary summary
) {

    public ReconciliationReport {
        results = List.copyOf(results);
        issues = List.copyOf(issues);
    }
}
