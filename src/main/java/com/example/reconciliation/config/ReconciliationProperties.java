package com.example.reconciliation.config;

import com.example.reconciliation.domain.model.CollisionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Column layouts of the two ledgers and the matching policy, bound from {@code reconciliation.*}.
 * Defaults describe the layouts the partner and the processor currently send, so a fresh instance
 * is usable without any configuration file.
 */
@ConfigurationProperties(prefix = "reconciliation")
@Validated
public class ReconciliationProperties {

    private static final String COLUMN_PATTERN = "[A-Za-z]{1,3}";

    @Valid
    private final StatementLayout statement = new StatementLayout();

    @Valid
    private final SettlementLayout settlement = new SettlementLayout();

    @Valid
    private final Matching matching = new Matching();

    public StatementLayout getStatement() {
        return statement;
    }

    public SettlementLayout getSettlement() {
        return settlement;
    }

    public Matching getMatching() {
        return matching;
    }

    /**
     * Positional layout shared by both ledgers. Row numbers are 0-based indices into the raw table.
     */
    public abstract static class TableLayout {

        @NotNull
        private List<@Min(0) Integer> skipRows;

        @Min(0)
        private int headerRow;

        @NotNull
        @Pattern(regexp = COLUMN_PATTERN)
        private String keyColumn = "D";

        @NotNull
        @Pattern(regexp = COLUMN_PATTERN)
        private String actionColumn;

        protected TableLayout(List<Integer> skipRows, int headerRow, String actionColumn) {
            this.skipRows = new ArrayList<>(skipRows);
            this.headerRow = headerRow;
            this.actionColumn = actionColumn;
        }

        public List<Integer> getSkipRows() {
            return skipRows;
        }

        public void setSkipRows(List<Integer> skipRows) {
            this.skipRows = skipRows;
        }

        public int getHeaderRow() {
            return headerRow;
        }

        public void setHeaderRow(int headerRow) {
            this.headerRow = headerRow;
        }

        public String getKeyColumn() {
            return keyColumn;
        }

        public void setKeyColumn(String keyColumn) {
            this.keyColumn = keyColumn;
        }

        public String getActionColumn() {
            return actionColumn;
        }

        public void setActionColumn(String actionColumn) {
            this.actionColumn = actionColumn;
        }

        /**
         * @return every row index that never holds data: the skipped rows plus the header row
         */
        public Set<Integer> nonDataRows() {
            Set<Integer> rows = new TreeSet<>(skipRows);
            rows.add(headerRow);
            return rows;
        }

        /**
         * @return every column letter this layout reads
         */
        public abstract List<String> mappedColumns();
    }

    public static class StatementLayout extends TableLayout {

        @NotNull
        @Pattern(regexp = COLUMN_PATTERN)
        private String amountColumn = "L";

        public StatementLayout() {
            super(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 10), 9, "B");
        }

        public String getAmountColumn() {
            return amountColumn;
        }

        public void setAmountColumn(String amountColumn) {
            this.amountColumn = amountColumn;
        }

        @Override
        public List<String> mappedColumns() {
            return List.of(getActionColumn(), getKeyColumn(), amountColumn);
        }
    }

    public static class SettlementLayout extends TableLayout {

        @NotNull
        @Pattern(regexp = COLUMN_PATTERN)
        private String payoutColumn = "K";

        @NotNull
        @Pattern(regexp = COLUMN_PATTERN)
        private String rateColumn = "M";

        public SettlementLayout() {
            super(IntStream.range(0, 2).boxed().toList(), 2, "F");
        }

        public String getPayoutColumn() {
            return payoutColumn;
        }

        public void setPayoutColumn(String payoutColumn) {
            this.payoutColumn = payoutColumn;
        }

        public String getRateColumn() {
            return rateColumn;
        }

        public void setRateColumn(String rateColumn) {
            this.rateColumn = rateColumn;
        }

        @Override
        public List<String> mappedColumns() {
            return List.of(getKeyColumn(), getActionColumn(), payoutColumn, rateColumn);
        }
    }

    public static class Matching {

        @NotNull
        @DecimalMin("0")
        private BigDecimal tolerance = new BigDecimal("0.01");

        @NotNull
        private CollisionPolicy collisionPolicy = CollisionPolicy.FOLD;

        @Min(2)
        @Max(20)
        private int conversionScale = 10;

        public BigDecimal getTolerance() {
            return tolerance;
        }

        public void setTolerance(BigDecimal tolerance) {
            this.tolerance = tolerance;
        }

        public CollisionPolicy getCollisionPolicy() {
            return collisionPolicy;
        }

        public void setCollisionPolicy(CollisionPolicy collisionPolicy) {
            this.collisionPolicy = collisionPolicy;
        }

        public int getConversionScale() {
            return conversionScale;
        }

        public void setConversionScale(int conversionScale) {
            this.conversionScale = conversionScale;
        }
    }
}
