package com.example.reconciliation.domain.model;

/**
 * Final decision for a reconciled PartnerPin.
 */
public enum ReconcileOutcome {
    RECONCILED("Reconciled"),
    AMOUNT_MISMATCH("Amount Mismatch"),
    MISSING_IN_STATEMENT("Missing in Statement"),
    MISSING_IN_SETTLEMENT("Missing in Settlement");

    private final String label;

    ReconcileOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
