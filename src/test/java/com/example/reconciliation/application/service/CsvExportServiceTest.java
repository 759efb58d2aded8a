package com.example.reconciliation.application.service;

import com.example.reconciliation.application.exception.CsvExportValidationException;
import com.example.reconciliation.domain.model.Classification;
import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.ReconcileOutcome;
import com.example.reconciliation.domain.model.ReconciliationReport;
import com.example.reconciliation.domain.model.ReconciliationResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests verifying the CSV export application service honors validation rules and produces the result table.
 */
class CsvExportServiceTest {

    private final CsvExportService service = new CsvExportService();

    /**
     * Ensures validation fails when no cached report exists in the session.
     */
    @Test
    void exportRequiresCachedReport() {
        assertThrows(CsvExportValidationException.class, () -> service.exportResults(null, null));
    }

    /**
     * Ensures validation fails when the selection matches nothing.
     */
    @Test
    void exportRequiresMatchingRows() {
        ReconciliationReport report = sampleReport();

        assertThrows(CsvExportValidationException.class,
                () -> service.exportResults(report, EnumSet.of(Classification.PRESENT_IN_SETTLEMENT_ONLY)));
    }

    /**
     * Ensures amounts are shown with two decimals and absent values stay blank.
     */
    @Test
    void exportRendersFixedDecimalsAndBlanks() {
        String csv = service.exportResults(sampleReport(), null);

        assertThat(csv.lines()).containsExactly(
                "PartnerPin,Classification,StatementAmount,SettlementAmountUSD,AmountVariance,FinalReconcileStatus",
                "12345678901,Present in Both,100.00,97.55,-2.45,Amount Mismatch",
                "55555555555,Not Present in the Settlement File but are present in the Statement File,1250.00,,,Missing in Settlement");
    }

    /**
     * Ensures only the selected classifications are exported.
     */
    @Test
    void exportFiltersByClassification() {
        String csv = service.exportResults(sampleReport(), EnumSet.of(Classification.PRESENT_IN_BOTH));

        assertThat(csv.lines()).hasSize(2);
        assertThat(csv).contains("12345678901").doesNotContain("55555555555");
    }

    @Test
    void formatAmountRoundsHalfUp() {
        assertThat(CsvExportService.formatAmount(new BigDecimal("97.5512"))).isEqualTo("97.55");
        assertThat(CsvExportService.formatAmount(new BigDecimal("0.125"))).isEqualTo("0.13");
        assertThat(CsvExportService.formatAmount(null)).isEmpty();
    }

    /**
     * @return sample report used across the test cases
     */
    private ReconciliationReport sampleReport() {
        List<ReconciliationResult> results = List.of(
                ReconciliationResult.matched(new PartnerPin("12345678901"), new BigDecimal("100.00"),
                        new BigDecimal("97.5512"), new BigDecimal("-2.45"), ReconcileOutcome.AMOUNT_MISMATCH),
                ReconciliationResult.statementOnly(new PartnerPin("55555555555"), new BigDecimal("1250")));
        return new ReconciliationReport("statement.csv", "settlement.csv", results, List.of(), null);
    }
}
