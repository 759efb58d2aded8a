package com.example.reconciliation.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ColumnReferenceTest {

    @ParameterizedTest
    @CsvSource({"A,0", "B,1", "D,3", "L,11", "M,12", "Z,25", "AA,26", "AZ,51"})
    void mapsLettersToIndices(String letters, int index) {
        assertThat(ColumnReference.toIndex(letters)).isEqualTo(index);
    }

    @Test
    void isCaseInsensitive() {
        assertThat(ColumnReference.toIndex(" l ")).isEqualTo(11);
    }

    @Test
    void rejectsInvalidReferences() {
        assertThrows(IllegalArgumentException.class, () -> ColumnReference.toIndex(""));
        assertThrows(IllegalArgumentException.class, () -> ColumnReference.toIndex("B2"));
        assertThrows(IllegalArgumentException.class, () -> ColumnReference.toIndex(null));
    }
}
