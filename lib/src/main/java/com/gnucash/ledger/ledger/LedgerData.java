package com.gnucash.ledger.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Immutable snapshot of the accounts and transactions of one book. */
public final class LedgerData {
    private final List<Account> accounts;
    private final List<Transaction> transactions;
    private final Map<String, Account> accountsById;

    public LedgerData(List<Account> accounts, List<Transaction> transactions) {
        this.accounts = List.copyOf(accounts);
        this.transactions = List.copyOf(transactions);
        Map<String, Account> byId = new LinkedHashMap<>();
        for (Account account : this.accounts) {
            byId.put(account.getId(), account);
        }
        this.accountsById = Collections.unmodifiableMap(byId);
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public List<Transaction> getTransactions() {
        return transactions;
    }

    public Map<String, Account> getAccountsById() {
        return accountsById;
    }

    public Optional<Account> findAccount(String id) {
        return Optional.ofNullable(accountsById.get(id));
    }

    public Optional<Transaction> findTransaction(String id) {
        for (Transaction transaction : transactions) {
            if (transaction.getId().equals(id)) {
                return Optional.of(transaction);
            }
        }
        return Optional.empty();
    }

    /** Transactions with at least one split on {@code accountId}, in file order. */
    public List<Transaction> transactionsFor(String accountId) {
        List<Transaction> matches = new ArrayList<>();
        for (Transaction transaction : transactions) {
            if (transaction.references(accountId)) {
                matches.add(transaction);
            }
        }
        return matches;
    }

    public boolean isAccountInUse(String accountId) {
        for (Transaction transaction : transactions) {
            if (transaction.references(accountId)) {
                return true;
            }
        }
        return false;
    }

    /** Colon-separated path from the top-level account down, excluding the root sentinel. */
    public String fullName(String accountId) {
        List<String> names = new ArrayList<>();
        Account current = accountsById.get(accountId);
        int guard = accountsById.size();
        while (current != null && current.getType() != AccountType.ROOT && guard-- >= 0) {
            names.add(0, current.getName());
            current = current.getParentId() == null ? null : accountsById.get(current.getParentId());
        }
        return String.join(":", names);
    }
}
