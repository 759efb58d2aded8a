package com.example.reconciliation.domain.model;

import java.math.BigDecimal;

/**
 * Common view of a normalized ledger record as seen by the matcher.
 */
public interface ReconcilableRecord {

    int rowNumber();

    PartnerPin pin();

    boolean reconcileEligible();

    /**
     * @return amount compared across ledgers, in USD
     */
    BigDecimal comparableAmount();
}
