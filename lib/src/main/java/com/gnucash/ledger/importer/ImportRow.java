package com.gnucash.ledger.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** One normalized statement line. Only rows with both a date and an amount are ever produced. */
public final class ImportRow {
    private final String externalId;
    private final LocalDate date;
    private final String description;
    private final BigDecimal amount;
    private final String memo;
    private final boolean duplicate;

    public ImportRow(
            String externalId, LocalDate date, String description, BigDecimal amount, String memo, boolean duplicate) {
        this.externalId = externalId;
        this.date = Objects.requireNonNull(date, "date");
        this.description = description == null ? "" : description;
        this.amount = Objects.requireNonNull(amount, "amount");
        this.memo = memo;
        this.duplicate = duplicate;
    }

    public ImportRow(String externalId, LocalDate date, String description, BigDecimal amount, String memo) {
        this(externalId, date, description, amount, memo, false);
    }

    /** Bank-assigned id (OFX FITID); null for delimited and spreadsheet imports. */
    public String getExternalId() {
        return externalId;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getMemo() {
        return memo;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public ImportRow withDuplicate(boolean newDuplicate) {
        return new ImportRow(externalId, date, description, amount, memo, newDuplicate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImportRow)) {
            return false;
        }
        ImportRow that = (ImportRow) o;
        return duplicate == that.duplicate
                && Objects.equals(externalId, that.externalId)
                && date.equals(that.date)
                && description.equals(that.description)
                && amount.compareTo(that.amount) == 0
                && Objects.equals(memo, that.memo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(externalId, date, description, amount.stripTrailingZeros(), memo, duplicate);
    }

    @Override
    public String toString() {
        return "ImportRow{" + date + " " + amount + " '" + description + "'"
                + (externalId == null ? "" : " id=" + externalId)
                + (duplicate ? " duplicate" : "") + "}";
    }
}
