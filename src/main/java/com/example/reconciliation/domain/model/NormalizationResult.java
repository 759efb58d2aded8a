package com.example.reconciliation.domain.model;

import java.util.List;

/**
 * Output of a normalizer: the records that survived plus the rows it had to leave out.
 *
 * @param source        ledger that was normalized
 * @param candidateRows number of data rows considered after header rows were stripped
 * @param records       normalized records in file order
 * @param issues        rows excluded from the run, in file order
 * @param <T>           record type
 */
public record NormalizationResult<T extends ReconcilableRecord>(
        SourceType source,
        int candidateRows,
        List<T> records,
        List<RowIssue> issues
) {

    public NormalizationResult {
        records = List.copyOf(records);
        issues = List.copyOf(issues);
    }

    /**
     * @return records tagged "Should Reconcile"
     */
    public List<T> eligible() {
        return records.stream().filter(ReconcilableRecord::reconcileEligible).toList();
    }
}
