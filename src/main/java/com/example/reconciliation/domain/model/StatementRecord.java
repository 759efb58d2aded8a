package com.example.reconciliation.domain.model;

import java.math.BigDecimal;

/**
 * Normalized row of the partner statement.
 */
public record StatementRecord(
        int rowNumber,
        PartnerPin pin,
        String actionLabel,
        BigDecimal settleAmount,
        boolean duplicatePin,
        boolean reconcileEligible
) implements ReconcilableRecord {

    @Override
    public BigDecimal comparableAmount() {
        return settleAmount;
    }
}
