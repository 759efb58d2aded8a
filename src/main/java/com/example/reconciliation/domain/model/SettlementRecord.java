package com.example.reconciliation.domain.model;

import java.math.BigDecimal;

/**
 * Normalized row of the processor settlement. {@code amountUsd} is {@code payoutRoundAmt / apiRate}.
 */
public record SettlementRecord(
        int rowNumber,
        PartnerPin pin,
        String actionLabel,
        BigDecimal payoutRoundAmt,
        BigDecimal apiRate,
        BigDecimal amountUsd,
        boolean duplicatePin,
        boolean reconcileEligible
) implements ReconcilableRecord {

    @Override
    public BigDecimal comparableAmount() {
        return amountUsd;
    }
}
