package com.example.reconciliation.config;

import java.util.Locale;

/**
 * Converts spreadsheet column letters to 0-based indices ({@code A} = 0, {@code Z} = 25, {@code AA} = 26).
 */
public final class ColumnReference {

    private ColumnReference() {
    }

    public static int toIndex(String letters) {
        if (letters == null || letters.isBlank()) {
            throw new IllegalArgumentException("Column reference is required.");
        }
        String normalized = letters.trim().toUpperCase(Locale.ROOT);
        int index = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column reference: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index - 1;
    }
}
