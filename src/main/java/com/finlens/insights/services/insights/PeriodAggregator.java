package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.finlens.insights.config.InsightsProperties;
import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.MonthlyAggregate;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.services.aggregates.AggregateReadService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups income and expenses into gap-free, chronologically ordered period buckets.
 * <p>
 * YEAR and ALL_TIME are folded from monthly aggregates when the read service has any for the window. Only
 * whole months inside the window are folded; the partial leading and trailing months are scanned from the
 * transactions. Everything else, and those two when no aggregates exist, is computed with one pass over the transactions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PeriodAggregator {

    private final AggregateReadService aggregateReadService;
    private final CurrencyAmountResolver currencyAmountResolver;
    private final InsightFormatter insightFormatter;
    private final InsightsProperties properties;
    private final Clock clock;

    private static final class Slot {
        private final LocalDate start;
        private final LocalDate end;
        private BigDecimal income = BigDecimal.ZERO;
        private BigDecimal expenses = BigDecimal.ZERO;

        private Slot(LocalDate start, LocalDate end) {
            this.start = start;
            this.end = end;
        }
    }

    public DateWindow defaultWindow(InsightGranularity granularity, LocalDate firstTransactionDate) {
        return granularity.defaultWindow(firstTransactionDate, LocalDate.now(clock), properties.weekLookback());
    }

    /**
     * Buckets over the granularity's default window.
     *
     * @param firstTransactionDate earliest transaction date if already known, otherwise derived here
     */
    public List<PeriodBucket> computeBuckets(List<Transaction> transactions, InsightGranularity granularity,
                                             String baseCurrency, LocalDate firstTransactionDate) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        LocalDate first = firstTransactionDate != null ? firstTransactionDate : earliestDate(transactions);
        if (first == null) {
            return List.of();
        }
        return computeBuckets(transactions, granularity, defaultWindow(granularity, first), baseCurrency);
    }

    public List<PeriodBucket> computeBuckets(List<Transaction> transactions, InsightGranularity granularity,
                                             DateWindow window, String baseCurrency) {
        if (window == null || window.isEmpty()) {
            return List.of();
        }
        List<Transaction> source = transactions != null ? transactions : List.of();

        Map<String, Slot> slots = enumerateSlots(granularity, window);
        boolean folded = granularity.supportsMonthlyAggregates() && foldMonthlyAggregates(slots, granularity, window, baseCurrency);
        // after a fold, only months partly inside the window still come from the raw transactions
        scanTransactions(slots, source, granularity, window, baseCurrency, folded);

        LocalDate today = LocalDate.now(clock);
        List<PeriodBucket> out = new ArrayList<>(slots.size());
        slots.forEach((key, slot) -> out.add(PeriodBucket.builder()
                .key(key)
                .granularity(granularity)
                .periodStart(slot.start)
                .periodEnd(slot.end)
                .label(granularity.label(slot.start, today, insightFormatter.getLocale()))
                .income(slot.income)
                .expenses(slot.expenses)
                .build()));

        log.debug("[PeriodAggregator] granularity={} window={}..{} buckets={} fastPath={}",
                granularity, window.start(), window.end(), out.size(), folded);
        return out;
    }

    /**
     * Whether the whole calendar month starting at {@code monthStart} lies inside the window.
     */
    static boolean monthInside(LocalDate monthStart, DateWindow window) {
        return !monthStart.isBefore(window.start()) && !monthStart.plusMonths(1).isAfter(window.end());
    }

    /**
     * Income and expenses of exactly the given transactions, skipping ones dated after today.
     */
    public PeriodSummary summarize(List<Transaction> transactions, String baseCurrency) {
        if (transactions == null || transactions.isEmpty()) {
            return PeriodSummary.EMPTY;
        }
        LocalDate today = LocalDate.now(clock);
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        for (Transaction tx : transactions) {
            if (tx == null || tx.getDate() == null || tx.getDate().isAfter(today)) {
                continue;
            }
            if (tx.isIncome()) {
                income = income.add(currencyAmountResolver.resolve(tx, baseCurrency));
            } else if (tx.isExpense()) {
                expenses = expenses.add(currencyAmountResolver.resolve(tx, baseCurrency));
            }
        }
        return new PeriodSummary(income, expenses);
    }

    public static LocalDate earliestDate(List<Transaction> transactions) {
        if (transactions == null) {
            return null;
        }
        return transactions.stream()
                .filter(Objects::nonNull)
                .map(Transaction::getDate)
                .filter(Objects::nonNull)
                .min(LocalDate::compareTo)
                .orElse(null);
    }

    private Map<String, Slot> enumerateSlots(InsightGranularity granularity, DateWindow window) {
        Map<String, Slot> slots = new LinkedHashMap<>();
        if (granularity == InsightGranularity.ALL_TIME) {
            slots.put(InsightGranularity.ALL_TIME_KEY, new Slot(window.start(), window.end()));
            return slots;
        }
        LocalDate cursor = granularity.periodStart(window.start());
        while (cursor.isBefore(window.end())) {
            LocalDate next = granularity.next(cursor);
            slots.putIfAbsent(granularity.key(cursor), new Slot(cursor, next));
            cursor = next;
        }
        return slots;
    }

    private boolean foldMonthlyAggregates(Map<String, Slot> slots, InsightGranularity granularity,
                                          DateWindow window, String baseCurrency) {
        List<MonthlyAggregate> records = aggregateReadService.fetchMonthlyAggregates(window.start(), window.end(), baseCurrency);
        if (records == null || records.isEmpty()) {
            return false;
        }
        for (MonthlyAggregate record : records) {
            LocalDate monthStart = record.monthStart();
            if (!monthInside(monthStart, window)) {
                continue;
            }
            Slot slot = slots.get(granularity.key(monthStart));
            if (slot == null) {
                continue;
            }
            slot.income = slot.income.add(InsightUtils.nullToZero(record.totalIncome()));
            slot.expenses = slot.expenses.add(InsightUtils.nullToZero(record.totalExpenses()));
        }
        return true;
    }

    private void scanTransactions(Map<String, Slot> slots, List<Transaction> transactions,
                                  InsightGranularity granularity, DateWindow window, String baseCurrency,
                                  boolean partialMonthsOnly) {
        for (Transaction tx : transactions) {
            if (tx == null || !window.contains(tx.getDate())) {
                continue;
            }
            if (partialMonthsOnly && monthInside(tx.getDate().withDayOfMonth(1), window)) {
                continue;
            }
            if (!tx.isIncome() && !tx.isExpense()) {
                continue;
            }
            Slot slot = slots.get(granularity.key(tx.getDate()));
            if (slot == null) {
                continue;
            }
            BigDecimal amount = currencyAmountResolver.resolve(tx, baseCurrency);
            if (tx.isIncome()) {
                slot.income = slot.income.add(amount);
            } else {
                slot.expenses = slot.expenses.add(amount);
            }
        }
    }
}
