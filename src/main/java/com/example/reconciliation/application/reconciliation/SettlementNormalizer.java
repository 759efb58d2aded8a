package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.config.ColumnReference;
import com.example.reconciliation.config.ReconciliationProperties;
import com.example.reconciliation.config.ReconciliationProperties.SettlementLayout;
import com.example.reconciliation.domain.exception.UnparseableAmountException;
import com.example.reconciliation.domain.model.IssueKind;
import com.example.reconciliation.domain.model.NormalizationResult;
import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.RawRow;
import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.domain.model.RowIssue;
import com.example.reconciliation.domain.model.SettlementRecord;
import com.example.reconciliation.domain.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the raw processor settlement into tagged {@link SettlementRecord}s with a USD amount
 * of {@code PayoutRoundAmt / APIRate}.
 *
 * <p>A unique PartnerPin is always reconciled; a duplicated one only on its {@code Cancel} row.
 * Rows whose payout or rate is not numeric, or whose rate is zero, carry no usable amount and are
 * excluded from the run (reported as row issues), so they take no part in duplicate detection either.
 */
@Component
public class SettlementNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SettlementNormalizer.class);

    private final PartnerPinExtractor pinExtractor;
    private final AmountParser amountParser;
    private final SettlementLayout layout;
    private final int keyColumn;
    private final int actionColumn;
    private final int payoutColumn;
    private final int rateColumn;
    private final int conversionScale;

    public SettlementNormalizer(PartnerPinExtractor pinExtractor,
                                AmountParser amountParser,
                                ReconciliationProperties properties) {
        this.pinExtractor = pinExtractor;
        this.amountParser = amountParser;
        this.layout = properties.getSettlement();
        this.keyColumn = ColumnReference.toIndex(layout.getKeyColumn());
        this.actionColumn = ColumnReference.toIndex(layout.getActionColumn());
        this.payoutColumn = ColumnReference.toIndex(layout.getPayoutColumn());
        this.rateColumn = ColumnReference.toIndex(layout.getRateColumn());
        this.conversionScale = properties.getMatching().getConversionScale();
    }

    /**
     * Normalizes one settlement table. The input is not modified.
     *
     * @param table raw settlement, header rows included
     * @return records in file order plus the rows that were left out
     */
    public NormalizationResult<SettlementRecord> normalize(RawTable table) {
        List<RawRow> rows = LedgerRows.dataRows(table, SourceType.SETTLEMENT, layout);
        List<RowIssue> issues = new ArrayList<>();
        List<KeyedRow> keyedRows = new ArrayList<>(rows.size());

        for (RawRow row : rows) {
            String key = row.cell(keyColumn);
            Optional<PartnerPin> pin = pinExtractor.extract(key);
            if (pin.isEmpty()) {
                issues.add(issue(row, IssueKind.MALFORMED_KEY, key));
                continue;
            }
            BigDecimal payout;
            BigDecimal rate;
            try {
                payout = amountParser.parse(row.cell(payoutColumn));
                rate = amountParser.parse(row.cell(rateColumn));
            } catch (UnparseableAmountException ex) {
                issues.add(issue(row, IssueKind.UNPARSEABLE_AMOUNT, ex.getRawValue()));
                continue;
            }
            if (rate.signum() == 0) {
                issues.add(issue(row, IssueKind.DIVISION_BY_ZERO, row.cell(rateColumn)));
                continue;
            }
            BigDecimal amountUsd = payout.divide(rate, conversionScale, RoundingMode.HALF_UP);
            keyedRows.add(new KeyedRow(row.rowNumber(), pin.get(), row.cell(actionColumn).trim(),
                    payout, rate, amountUsd));
        }

        Map<PartnerPin, Integer> occurrences = LedgerRows.occurrences(keyedRows.stream().map(KeyedRow::pin).toList());
        List<SettlementRecord> records = keyedRows.stream()
                .map(keyed -> {
                    boolean duplicate = occurrences.get(keyed.pin()) > 1;
                    return new SettlementRecord(keyed.rowNumber(), keyed.pin(), keyed.actionLabel(),
                            keyed.payout(), keyed.rate(), keyed.amountUsd(),
                            duplicate, isEligible(keyed.actionLabel(), duplicate));
                })
                .toList();

        NormalizationResult<SettlementRecord> result =
                new NormalizationResult<>(SourceType.SETTLEMENT, rows.size(), records, issues);
        log.info("Settlement '{}': {} data rows, {} records, {} eligible, {} excluded",
                table.name(), rows.size(), records.size(), result.eligible().size(), issues.size());
        return result;
    }

    /**
     * Settlement tagging rule. There is no "Dollar Received" label in this ledger.
     *
     * @param actionLabel  value of the Cancel column
     * @param duplicatePin whether another surviving row carries the same PartnerPin
     * @return {@code true} for "Should Reconcile"
     */
    static boolean isEligible(String actionLabel, boolean duplicatePin) {
        return !duplicatePin || ActionLabels.isCancel(actionLabel);
    }

    private RowIssue issue(RawRow row, IssueKind kind, String detail) {
        log.debug("Settlement row {} excluded: {} ({})", row.rowNumber(), kind, detail);
        return new RowIssue(SourceType.SETTLEMENT, row.rowNumber(), kind, detail);
    }

    private record KeyedRow(int rowNumber,
                            PartnerPin pin,
                            String actionLabel,
                            BigDecimal payout,
                            BigDecimal rate,
                            BigDecimal amountUsd) {
    }
}
