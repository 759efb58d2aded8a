package com.example.reconciliation.application.service;

import com.example.reconciliation.application.exception.CsvExportValidationException;
import com.example.reconciliation.domain.model.Classification;
import com.example.reconciliation.domain.model.ReconciliationReport;
import com.example.reconciliation.domain.model.ReconciliationResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Set;

/**
 * Application-layer service that turns a reconciliation report into the downloadable result table.
 */
@Service
public class CsvExportService {

    static final String HEADER =
            "PartnerPin,Classification,StatementAmount,SettlementAmountUSD,AmountVariance,FinalReconcileStatus";

	/**
	 * Runs validation and returns a CSV string containing the results of the selected classifications.
	 *
	 * @param report          cached reconciliation report stored in the session
	 * @param classifications classifications to keep; {@code null} or empty keeps every row
	 * @return CSV content ready to stream to the browser
	 * @throws CsvExportValidationException when there is no report or nothing matches the selection
	 */
    public String exportResults(ReconciliationReport report, Set<Classification> classifications) {
        if (report == null || report.results() == null || report.results().isEmpty()) {
            throw new CsvExportValidationException("No reconciliation result available for export.");
        }

        List<ReconciliationResult> selected = report.results().stream()
                .filter(result -> classifications == null || classifications.isEmpty()
                        || classifications.contains(result.classification()))
                .toList();
        if (selected.isEmpty()) {
            throw new CsvExportValidationException("No reconciliation rows match the selected classifications.");
        }

        return buildCsv(selected);
    }

	/**
	 * Builds the CSV output: header row, then one line per result in report order.
	 * Amounts are shown with two decimals and absent amounts stay blank.
	 *
	 * @param results selected reconciliation results
	 * @return CSV document as a string
	 */
    private String buildCsv(List<ReconciliationResult> results) {
        StringBuilder builder = new StringBuilder();
        builder.append(HEADER).append('\n');
        for (ReconciliationResult result : results) {
            builder.append(result.pin().value()).append(',')
                    .append(escape(result.classification().label())).append(',')
                    .append(formatAmount(result.statementAmount())).append(',')
                    .append(formatAmount(result.settlementAmountUsd())).append(',')
                    .append(formatAmount(result.amountVariance())).append(',')
                    .append(escape(result.outcome().label()))
                    .append('\n');
        }
        return builder.toString();
    }

    static String formatAmount(BigDecimal amount) {
        if (amount == null) {
            return "";
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
