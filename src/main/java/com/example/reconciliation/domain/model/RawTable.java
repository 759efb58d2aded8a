package com.example.reconciliation.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, header-less view of an uploaded ledger file.
 *
 * @param name logical name (usually the uploaded file name)
 * @param rows rows in file order
 */
public record RawTable(String name, List<RawRow> rows) {

    public RawTable {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /**
     * Builds a table from plain cell lists, assigning row indices in order.
     *
     * @param name  logical table name
     * @param cells row-major cell values
     * @return new table
     */
    public static RawTable of(String name, List<List<String>> cells) {
        List<RawRow> rows = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            rows.add(new RawRow(i, cells.get(i)));
        }
        return new RawTable(name, rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
