package com.example.reconciliation.domain.model;

import java.util.List;

/**
 * Output of the matcher: results sorted by PartnerPin and any collisions it folded.
 */
public record MatchingResult(List<ReconciliationResult> results, List<RowIssue> issues) {

    public MatchingResult {
        results = List.copyOf(results);
        issues = List.copyOf(issues);
    }
}
