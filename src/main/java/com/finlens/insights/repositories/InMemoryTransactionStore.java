package com.finlens.insights.repositories;

import java.util.List;

import org.springframework.stereotype.Repository;

import com.finlens.insights.entities.Account;
import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.entities.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Holds the whole data set as one snapshot that is swapped atomically.
 */
@Slf4j
@Repository
public class InMemoryTransactionStore implements TransactionStore {

    public record Snapshot(
            List<Transaction> transactions,
            List<Account> accounts,
            List<Category> categories,
            List<RecurringSeries> recurringSeries
    ) {
        public static final Snapshot EMPTY = new Snapshot(List.of(), List.of(), List.of(), List.of());

        public Snapshot {
            transactions = transactions != null ? List.copyOf(transactions) : List.of();
            accounts = accounts != null ? List.copyOf(accounts) : List.of();
            categories = categories != null ? List.copyOf(categories) : List.of();
            recurringSeries = recurringSeries != null ? List.copyOf(recurringSeries) : List.of();
        }
    }

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public InMemoryTransactionStore() {
    }

    public InMemoryTransactionStore(Snapshot snapshot) {
        replace(snapshot);
    }

    public void replace(Snapshot next) {
        this.snapshot = next != null ? next : Snapshot.EMPTY;
        log.info("[TransactionStore] Snapshot replaced transactions={} accounts={} categories={} recurring={}",
                snapshot.transactions().size(), snapshot.accounts().size(),
                snapshot.categories().size(), snapshot.recurringSeries().size());
    }

    @Override
    public List<Transaction> listTransactions() {
        return snapshot.transactions();
    }

    @Override
    public List<Account> listAccounts() {
        return snapshot.accounts();
    }

    @Override
    public List<Category> listCategories() {
        return snapshot.categories();
    }

    @Override
    public List<RecurringSeries> listRecurringSeries() {
        return snapshot.recurringSeries();
    }
}
