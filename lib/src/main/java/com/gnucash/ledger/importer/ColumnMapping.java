package com.gnucash.ledger.importer;

/**
 * Explicit column indexes for a delimited statement whose headers could not be recognised.
 * Indexes are zero-based; a null memo column means no memo, a null header row means detect it.
 */
public final class ColumnMapping {
    private final int dateColumn;
    private final int descriptionColumn;
    private final int amountColumn;
    private final Integer memoColumn;
    private final boolean negateAmount;
    private final Integer headerRowIndex;

    public ColumnMapping(
            int dateColumn,
            int descriptionColumn,
            int amountColumn,
            Integer memoColumn,
            boolean negateAmount,
            Integer headerRowIndex) {
        this.dateColumn = requireIndex(dateColumn, "dateColumn");
        this.descriptionColumn = requireIndex(descriptionColumn, "descriptionColumn");
        this.amountColumn = requireIndex(amountColumn, "amountColumn");
        this.memoColumn = memoColumn == null ? null : requireIndex(memoColumn, "memoColumn");
        this.negateAmount = negateAmount;
        this.headerRowIndex = headerRowIndex == null ? null : requireIndex(headerRowIndex, "headerRowIndex");
    }

    public ColumnMapping(int dateColumn, int descriptionColumn, int amountColumn) {
        this(dateColumn, descriptionColumn, amountColumn, null, false, null);
    }

    public int getDateColumn() {
        return dateColumn;
    }

    public int getDescriptionColumn() {
        return descriptionColumn;
    }

    public int getAmountColumn() {
        return amountColumn;
    }

    public Integer getMemoColumn() {
        return memoColumn;
    }

    public boolean isNegateAmount() {
        return negateAmount;
    }

    public Integer getHeaderRowIndex() {
        return headerRowIndex;
    }

    public ColumnMapping withNegateAmount(boolean newNegateAmount) {
        return new ColumnMapping(dateColumn, descriptionColumn, amountColumn, memoColumn, newNegateAmount, headerRowIndex);
    }

    public ColumnMapping withHeaderRowIndex(Integer newHeaderRowIndex) {
        return new ColumnMapping(dateColumn, descriptionColumn, amountColumn, memoColumn, negateAmount, newHeaderRowIndex);
    }

    @Override
    public String toString() {
        return "ColumnMapping{date=" + dateColumn
                + ", description=" + descriptionColumn
                + ", amount=" + amountColumn
                + ", memo=" + memoColumn
                + ", negate=" + negateAmount
                + ", headerRow=" + headerRowIndex + "}";
    }

    private static int requireIndex(int index, String name) {
        if (index < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + index);
        }
        return index;
    }
}
