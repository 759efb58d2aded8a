package com.example.reconciliation.application.reconciliation;

import com.example.reconciliation.config.ColumnReference;
import com.example.reconciliation.config.ReconciliationProperties.TableLayout;
import com.example.reconciliation.domain.exception.EmptyInputTableException;
import com.example.reconciliation.domain.exception.MissingColumnException;
import com.example.reconciliation.domain.model.PartnerPin;
import com.example.reconciliation.domain.model.RawRow;
import com.example.reconciliation.domain.model.RawTable;
import com.example.reconciliation.domain.model.SourceType;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Row handling shared by both normalizers.
 */
final class LedgerRows {

    private LedgerRows() {
    }

    /**
     * Validates the table structure and strips the fixed header/boilerplate rows.
     * Fully blank rows are dropped as well.
     *
     * @param table  raw ledger
     * @param source ledger type, used in error messages
     * @param layout positional layout of the ledger
     * @return candidate data rows in file order
     * @throws EmptyInputTableException when there is no header row or no data row left
     * @throws MissingColumnException   when the header row is narrower than a mapped column
     */
    static List<RawRow> dataRows(RawTable table, SourceType source, TableLayout layout) {
        if (table == null || table.isEmpty() || layout.getHeaderRow() >= table.size()) {
            throw new EmptyInputTableException(source, table != null ? table.name() : null);
        }
        RawRow header = table.rows().get(layout.getHeaderRow());
        for (String column : layout.mappedColumns()) {
            if (ColumnReference.toIndex(column) >= header.cells().size()) {
                throw new MissingColumnException(source, column, header.cells().size());
            }
        }

        Set<Integer> nonDataRows = layout.nonDataRows();
        List<RawRow> rows = table.rows().stream()
                .filter(row -> !nonDataRows.contains(row.index()))
                .filter(row -> !row.isBlank())
                .toList();
        if (rows.isEmpty()) {
            throw new EmptyInputTableException(source, table.name());
        }
        return rows;
    }

    /**
     * Counts how many rows carry each PartnerPin.
     *
     * @param pins keys of the rows that survived extraction and parsing
     * @return occurrences per key
     */
    static Map<PartnerPin, Integer> occurrences(Collection<PartnerPin> pins) {
        Map<PartnerPin, Integer> counts = new HashMap<>();
        for (PartnerPin pin : pins) {
            counts.merge(pin, 1, Integer::sum);
        }
        return counts;
    }
}
