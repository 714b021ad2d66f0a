package com.gnucash.ledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * One {@code gnc:transaction} block with its ordered splits. The split values are expected to sum
 * to zero but nothing here enforces it; imports may deliberately leave an imbalance.
 */
public final class Transaction {
    public static final String DEFAULT_CURRENCY = "USD";

    private final String id;
    private final String description;
    private final LocalDate datePosted;
    private final LocalDate dateEntered;
    private final String notes;
    private final String currency;
    private final String num;
    private final List<Split> splits;
    private final List<String> extraSlots;

    public Transaction(
            String id,
            String description,
            LocalDate datePosted,
            LocalDate dateEntered,
            String notes,
            String currency,
            String num,
            List<Split> splits,
            List<String> extraSlots) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = description == null ? "" : description;
        this.datePosted = datePosted;
        this.dateEntered = dateEntered;
        this.notes = notes == null ? "" : notes;
        this.currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency;
        this.num = num == null ? "" : num;
        this.splits = splits == null ? List.of() : List.copyOf(splits);
        this.extraSlots = extraSlots == null ? List.of() : List.copyOf(extraSlots);
    }

    public static Transaction of(String id, String description, LocalDate datePosted, List<Split> splits) {
        return new Transaction(id, description, datePosted, null, "", DEFAULT_CURRENCY, "", splits, List.of());
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public LocalDate getDatePosted() {
        return datePosted;
    }

    /** Entry date; null until the transaction has been written once. */
    public LocalDate getDateEntered() {
        return dateEntered;
    }

    public String getNotes() {
        return notes;
    }

    public String getCurrency() {
        return currency;
    }

    public String getNum() {
        return num;
    }

    public List<Split> getSplits() {
        return splits;
    }

    public List<String> getExtraSlots() {
        return extraSlots;
    }

    /** Sum of split values; zero for a balanced transaction. */
    public BigDecimal imbalance() {
        BigDecimal total = BigDecimal.ZERO;
        for (Split split : splits) {
            total = total.add(split.getValue());
        }
        return total;
    }

    public boolean references(String accountId) {
        for (Split split : splits) {
            if (split.getAccountId().equals(accountId)) {
                return true;
            }
        }
        return false;
    }

    public Transaction withDescription(String newDescription) {
        return new Transaction(id, newDescription, datePosted, dateEntered, notes, currency, num, splits, extraSlots);
    }

    public Transaction withDateEntered(LocalDate newDateEntered) {
        return new Transaction(id, description, datePosted, newDateEntered, notes, currency, num, splits, extraSlots);
    }

    public Transaction withNotes(String newNotes) {
        return new Transaction(id, description, datePosted, dateEntered, newNotes, currency, num, splits, extraSlots);
    }

    public Transaction withSplits(List<Split> newSplits) {
        return new Transaction(id, description, datePosted, dateEntered, notes, currency, num, newSplits, extraSlots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transaction other)) {
            return false;
        }
        return id.equals(other.id)
                && description.equals(other.description)
                && Objects.equals(datePosted, other.datePosted)
                && Objects.equals(dateEntered, other.dateEntered)
                && notes.equals(other.notes)
                && currency.equals(other.currency)
                && num.equals(other.num)
                && splits.equals(other.splits)
                && extraSlots.equals(other.extraSlots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, datePosted);
    }

    @Override
    public String toString() {
        return "Transaction{" + id + " " + datePosted + " '" + description + "' splits=" + splits.size() + "}";
    }
}
