package com.example.reconciliation.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of the reconciliation output, keyed by a PartnerPin found in at least one eligible set.
 * Absent amounts are {@code null}; {@code amountVariance} is present only for {@link Classification#PRESENT_IN_BOTH}.
 */
public record ReconciliationResult(
        PartnerPin pin,
        Classification classification,
        BigDecimal statementAmount,
        BigDecimal settlementAmountUsd,
        BigDecimal amountVariance,
        ReconcileOutcome outcome
) {

    public ReconciliationResult {
        Objects.requireNonNull(pin, "pin");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(outcome, "outcome");
        boolean matched = classification == Classification.PRESENT_IN_BOTH;
        if (matched != (amountVariance != null)) {
            throw new IllegalArgumentException("Variance must be set exactly for matched pins: " + pin);
        }
    }

    public static ReconciliationResult matched(PartnerPin pin,
                                               BigDecimal statementAmount,
                                               BigDecimal settlementAmountUsd,
                                               BigDecimal amountVariance,
                                               ReconcileOutcome outcome) {
        return new ReconciliationResult(pin, Classification.PRESENT_IN_BOTH,
                statementAmount, settlementAmountUsd, amountVariance, outcome);
    }

    public static ReconciliationResult settlementOnly(PartnerPin pin, BigDecimal settlementAmountUsd) {
        return new ReconciliationResult(pin, Classification.PRESENT_IN_SETTLEMENT_ONLY,
                null, settlementAmountUsd, null, ReconcileOutcome.MISSING_IN_STATEMENT);
    }

    public static ReconciliationResult statementOnly(PartnerPin pin, BigDecimal statementAmount) {
        return new ReconciliationResult(pin, Classification.PRESENT_IN_STATEMENT_ONLY,
                statementAmount, null, null, ReconcileOutcome.MISSING_IN_SETTLEMENT);
    }
}
