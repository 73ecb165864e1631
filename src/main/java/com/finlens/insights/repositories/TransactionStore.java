package com.finlens.insights.repositories;

import java.util.List;

import com.finlens.insights.entities.Account;
import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.entities.Transaction;

/**
 * Read-only view of the user's financial data. Implementations return immutable snapshots.
 */
public interface TransactionStore {

    List<Transaction> listTransactions();

    List<Account> listAccounts();

    List<Category> listCategories();

    List<RecurringSeries> listRecurringSeries();
}
