package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.entities.Account;
import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightGranularity;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable input shared by every generator of one orchestrator pass.
 * {@code buckets} is the single list computed for the pass.
 */
@Value
@Builder
public class InsightContext {

    List<Transaction> windowedTransactions;
    List<Transaction> allTransactions;
    PeriodSummary summary;
    List<PeriodBucket> buckets;
    InsightGranularity granularity;
    DateWindow window;
    // "current period" is the one containing this date
    LocalDate referenceDate;
    LocalDate today;
    String baseCurrency;
    AccountBalanceLookup balanceLookup;
    @Builder.Default
    List<Account> accounts = List.of();
    @Builder.Default
    List<Category> categories = List.of();
    @Builder.Default
    List<RecurringSeries> recurringSeries = List.of();

    public Optional<PeriodBucket> bucket(String key) {
        return buckets.stream().filter(b -> b.getKey().equals(key)).findFirst();
    }

    public Optional<PeriodBucket> currentBucket() {
        return bucket(granularity.currentKey(referenceDate));
    }

    public Optional<PeriodBucket> previousBucket() {
        if (granularity == InsightGranularity.ALL_TIME) {
            return Optional.empty();
        }
        return bucket(granularity.previousKey(referenceDate));
    }

    /** Transactions of the current bucket, or the whole window when the bucket is absent. */
    public List<Transaction> currentPeriodTransactions() {
        return currentBucket()
                .map(b -> windowedTransactions.stream()
                        .filter(tx -> tx.getDate() != null)
                        .filter(tx -> !tx.getDate().isBefore(b.getPeriodStart()) && tx.getDate().isBefore(b.getPeriodEnd()))
                        .toList())
                .orElse(windowedTransactions);
    }

    public BigDecimal balanceOf(Account account) {
        if (balanceLookup == null || account == null) {
            return BigDecimal.ZERO;
        }
        return InsightUtils.nullToZero(balanceLookup.balanceOf(account.getId()));
    }

    public BigDecimal totalBalance() {
        return accounts.stream()
                .filter(Objects::nonNull)
                .map(this::balanceOf)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
