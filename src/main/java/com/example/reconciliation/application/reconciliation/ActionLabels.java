package com.example.reconciliation.application.reconciliation;

import java.util.Locale;

/**
 * Action labels that drive tagging. Comparison trims the cell and ignores case,
 * so {@code " cancel "} and {@code "CANCEL"} both count as Cancel.
 */
final class ActionLabels {

    static final String CANCEL = "Cancel";
    static final String DOLLAR_RECEIVED = "Dollar Received";

    private ActionLabels() {
    }

    static boolean isCancel(String label) {
        return matches(label, CANCEL);
    }

    static boolean isDollarReceived(String label) {
        return matches(label, DOLLAR_RECEIVED);
    }

    private static boolean matches(String label, String expected) {
        return label != null && label.trim().toLowerCase(Locale.ROOT).equals(expected.toLowerCase(Locale.ROOT));
    }
}
