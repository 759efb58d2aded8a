package com.example.reconciliation.domain.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counters describing one reconciliation run.
 */
public record ReconciliationSummary(
        int statementRows,
        int statementRecords,
        int statementEligible,
        int settlementRows,
        int settlementRecords,
        int settlementEligible,
        Map<Classification, Long> byClassification,
        Map<ReconcileOutcome, Long> byOutcome,
        int skippedRows
) {

    /**
     * Derives the counters from the intermediate results of a run.
     *
     * @param statement  normalized statement
     * @param settlement normalized settlement
     * @param matching   matcher output
     * @return populated summary
     */
    public static ReconciliationSummary of(NormalizationResult<StatementRecord> statement,
                                           NormalizationResult<SettlementRecord> settlement,
                                           MatchingResult matching) {
        Map<Classification, Long> byClassification = new EnumMap<>(Classification.class);
        Map<ReconcileOutcome, Long> byOutcome = new EnumMap<>(ReconcileOutcome.class);
        for (ReconciliationResult result : matching.results()) {
            byClassification.merge(result.classification(), 1L, Long::sum);
            byOutcome.merge(result.outcome(), 1L, Long::sum);
        }
        return new ReconciliationSummary(
                statement.candidateRows(),
                statement.records().size(),
                statement.eligible().size(),
                settlement.candidateRows(),
                settlement.records().size(),
                settlement.eligible().size(),
                Map.copyOf(byClassification),
                Map.copyOf(byOutcome),
                countExcluded(statement.issues()) + countExcluded(settlement.issues())
        );
    }

    public long count(Classification classification) {
        return byClassification.getOrDefault(classification, 0L);
    }

    public long count(ReconcileOutcome outcome) {
        return byOutcome.getOrDefault(outcome, 0L);
    }

    private static int countExcluded(List<RowIssue> issues) {
        return (int) issues.stream().filter(issue -> issue.kind().excludesRow()).count();
    }
}
