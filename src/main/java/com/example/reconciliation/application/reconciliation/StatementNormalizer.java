package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.config.ColumnReference;
import com.example.reconciliation.config.ReconciliationProperties;
import com.example.reconciliation.config.ReconciliationProperties.StatementLayout;
import com.example.reconciliation.domain.exception.UnparseableAmountException;
import com.example.reconciliation.domain.model.IssueKind;
import com.example.reconciliation.domain.model.NormalizationResult;
import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.RawRow;
import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.domain.model.RowIssue;
import com.example.reconciliation.domain.model.SourceType;
import com.example.reconciliation.domain.model.StatementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the raw partner statement into tagged {@link StatementRecord}s.
 *
 * <p>Tagging, per row:
 * <ul>
 *     <li>{@code Dollar Received} is never reconciled, duplicated or not;</li>
 *     <li>a duplicated PartnerPin is reconciled only on its {@code Cancel} row;</li>
 *     <li>every other row with a unique PartnerPin is reconciled.</li>
 * </ul>
 * A duplicated row with any other label is therefore not reconciled.
 * Rows without a key or with an unparseable Settle.Amt are excluded and reported.
 */
@Component
public class StatementNormalizer {

    private static final Logger log = LoggerFactory.getLogger(StatementNormalizer.class);

    private final PartnerPinExtractor pinExtractor;
    private final AmountParser amountParser;
    private final StatementLayout layout;
    private final int actionColumn;
    private final int descriptionColumn;
    private final int amountColumn;

    public StatementNormalizer(PartnerPinExtractor pinExtractor,
                               AmountParser amountParser,
                               ReconciliationProperties properties) {
        this.pinExtractor = pinExtractor;
        this.amountParser = amountParser;
        this.layout = properties.getStatement();
        this.actionColumn = ColumnReference.toIndex(layout.getActionColumn());
        this.descriptionColumn = ColumnReference.toIndex(layout.getKeyColumn());
        this.amountColumn = ColumnReference.toIndex(layout.getAmountColumn());
    }

    /**
     * Normalizes one statement table. The input is not modified.
     *
     * @param table raw statement, header rows included
     * @return records in file order plus the rows that were left out
     */
    public NormalizationResult<StatementRecord> normalize(RawTable table) {
        List<RawRow> rows = LedgerRows.dataRows(table, SourceType.STATEMENT, layout);
        List<RowIssue> issues = new ArrayList<>();
        List<KeyedRow> keyedRows = new ArrayList<>(rows.size());

        for (RawRow row : rows) {
            String description = row.cell(descriptionColumn);
            Optional<PartnerPin> pin = pinExtractor.extract(description);
            if (pin.isEmpty()) {
                issues.add(issue(row, IssueKind.MALFORMED_KEY, description));
                continue;
            }
            String rawAmount = row.cell(amountColumn);
            BigDecimal amount;
            try {
                amount = amountParser.parse(rawAmount);
            } catch (UnparseableAmountException ex) {
                issues.add(issue(row, IssueKind.UNPARSEABLE_AMOUNT, rawAmount));
                continue;
            }
            keyedRows.add(new KeyedRow(row.rowNumber(), pin.get(), row.cell(actionColumn).trim(), amount));
        }

        Map<PartnerPin, Integer> occurrences = LedgerRows.occurrences(keyedRows.stream().map(KeyedRow::pin).toList());
        List<StatementRecord> records = keyedRows.stream()
                .map(keyed -> {
                    boolean duplicate = occurrences.get(keyed.pin()) > 1;
                    return new StatementRecord(keyed.rowNumber(), keyed.pin(), keyed.actionLabel(), keyed.amount(),
                            duplicate, isEligible(keyed.actionLabel(), duplicate));
                })
                .toList();

        NormalizationResult<StatementRecord> result =
                new NormalizationResult<>(SourceType.STATEMENT, rows.size(), records, issues);
        log.info("Statement '{}': {} data rows, {} records, {} eligible, {} excluded",
                table.name(), rows.size(), records.size(), result.eligible().size(), issues.size());
        return result;
    }

    /**
     * Statement tagging rule.
     *
     * @param actionLabel   value of the action column
     * @param duplicatePin  whether another surviving row carries the same PartnerPin
     * @return {@code true} for "Should Reconcile"
     */
    static boolean isEligible(String actionLabel, boolean duplicatePin) {
        if (ActionLabels.isDollarReceived(actionLabel)) {
            return false;
        }
        if (duplicatePin) {
            return ActionLabels.isCancel(actionLabel);
        }
        return true;
    }

    private RowIssue issue(RawRow row, IssueKind kind, String detail) {
        log.debug("Statement row {} excluded: {} ({})", row.rowNumber(), kind, detail);
        return new RowIssue(SourceType.STATEMENT, row.rowNumber(), kind, detail);
    }

    private record KeyedRow(int rowNumber, PartnerPin pin, String actionLabel, BigDecimal amount) {
    }
}
