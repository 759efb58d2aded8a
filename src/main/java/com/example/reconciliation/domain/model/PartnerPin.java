package com.example.reconciliation.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Join key shared by the partner statement and the processor settlement.
 * Always exactly {@value #LENGTH} ASCII digits.
 */
public record PartnerPin(@JsonValue String value) implements Comparable<PartnerPin> {

    public static final int LENGTH = 11;

    public PartnerPin {
        if (value == null || value.length() != LENGTH) {
            throw new IllegalArgumentException("PartnerPin must have exactly " + LENGTH + " digits: " + value);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("PartnerPin must contain digits only: " + value);
            }
        }
    }

    @Override
    public int compareTo(PartnerPin other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
