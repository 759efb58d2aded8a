package com.example.reconciliation.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Presence of a PartnerPin across the two eligible sets.
 */
public enum Classification {
    PRESENT_IN_BOTH("Present in Both"),
    PRESENT_IN_SETTLEMENT_ONLY("Present in the Settlement File but not in the Partner Statement File"),
    PRESENT_IN_STATEMENT_ONLY("Not Present in the Settlement File but are present in the Statement File");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    /**
     * @return wording used in the result table and the CSV export
     */
    public String label() {
        return label;
    }

	/**
	 * Converts request parameters into a set of classifications.
	 * Unknown values are ignored; an empty or fully invalid selection means every classification.
	 *
	 * @param rawValues enum names supplied by the caller
	 * @return parsed classification set
	 */
    public static EnumSet<Classification> fromStrings(List<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return EnumSet.allOf(Classification.class);
        }
        EnumSet<Classification> selected = EnumSet.noneOf(Classification.class);
        for (String value : rawValues) {
            Classification classification = fromString(value);
            if (classification != null) {
                selected.add(classification);
            }
        }
        if (selected.isEmpty()) {
            return EnumSet.allOf(Classification.class);
        }
        return selected;
    }

    private static Classification fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return Classification.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
