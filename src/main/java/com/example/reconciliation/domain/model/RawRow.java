package com.example.reconciliation.domain.model;

import java.util.List;

/**
 * One row of an uploaded table, positioned by column index only.
 * Header names carry no meaning; the column layout decides what each cell is.
 *
 * @param index 0-based position of the row in the raw table
 * @param cells cell values in column order, never {@code null}
 */
public record RawRow(int index, List<String> cells) {

    public RawRow {
        cells = cells == null ? List.of() : List.copyOf(cells.stream().map(cell -> cell == null ? "" : cell).toList());
    }

    /**
     * Returns the cell at the given column, or an empty string when the row is shorter.
     *
     * @param column 0-based column index
     * @return raw cell value
     */
    public String cell(int column) {
        if (column < 0 || column >= cells.size()) {
            return "";
        }
        return cells.get(column);
    }

    /**
     * @return 1-based row number as shown by spreadsheet tools
     */
    public int rowNumber() {
        return index + 1;
    }

    public boolean isBlank() {
        return cells.stream().allMatch(String::isBlank);
    }
}
