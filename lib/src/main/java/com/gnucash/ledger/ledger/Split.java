package com.gnucash.ledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** One leg of a transaction, tied to exactly one account. */
public final class Split {
    private final String id;
    private final String accountId;
    private final BigDecimal value;
    private final BigDecimal quantity;
    private final ReconciledState reconciledState;
    private final LocalDate reconcileDate;
    private final String memo;
    private final String action;
    private final String onlineId;
    private final List<String> extraSlots;

    public Split(
            String id,
            String accountId,
            BigDecimal value,
            BigDecimal quantity,
            ReconciledState reconciledState,
            LocalDate reconcileDate,
            String memo,
            String action,
            String onlineId,
            List<String> extraSlots) {
        this.id = Objects.requireNonNull(id, "id");
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.value = value == null ? BigDecimal.ZERO : value;
        this.quantity = quantity == null ? this.value : quantity;
        this.reconciledState = reconciledState == null ? ReconciledState.NOT_RECONCILED : reconciledState;
        this.reconcileDate = reconcileDate;
        this.memo = memo == null ? "" : memo;
        this.action = action == null ? "" : action;
        this.onlineId = onlineId;
        this.extraSlots = extraSlots == null ? List.of() : List.copyOf(extraSlots);
    }

    /** Unreconciled split whose quantity equals its value. */
    public static Split of(String id, String accountId, BigDecimal value, String memo) {
        return new Split(id, accountId, value, value, ReconciledState.NOT_RECONCILED, null, memo, "", null, List.of());
    }

    public String getId() {
        return id;
    }

    public String getAccountId() {
        return accountId;
    }

    /** Signed amount in the transaction currency, GnuCash sign convention. */
    public BigDecimal getValue() {
        return value;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public ReconciledState getReconciledState() {
        return reconciledState;
    }

    public LocalDate getReconcileDate() {
        return reconcileDate;
    }

    public String getMemo() {
        return memo;
    }

    public String getAction() {
        return action;
    }

    /** Bank-assigned transaction id (FITID) recorded when the split was imported, or null. */
    public String getOnlineId() {
        return onlineId;
    }

    public List<String> getExtraSlots() {
        return extraSlots;
    }

    public Split withAccountId(String newAccountId) {
        return new Split(
                id, newAccountId, value, quantity, reconciledState, reconcileDate, memo, action, onlineId, extraSlots);
    }

    public Split withOnlineId(String newOnlineId) {
        return new Split(
                id, accountId, value, quantity, reconciledState, reconcileDate, memo, action, newOnlineId, extraSlots);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Split other)) {
            return false;
        }
        return id.equals(other.id)
                && accountId.equals(other.accountId)
                && value.compareTo(other.value) == 0
                && quantity.compareTo(other.quantity) == 0
                && reconciledState == other.reconciledState
                && Objects.equals(reconcileDate, other.reconcileDate)
                && memo.equals(other.memo)
                && action.equals(other.action)
                && Objects.equals(onlineId, other.onlineId)
                && extraSlots.equals(other.extraSlots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, accountId, value.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "Split{" + id + " " + accountId + " " + value.toPlainString() + "}";
    }
}
