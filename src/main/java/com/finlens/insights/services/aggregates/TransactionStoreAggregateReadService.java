package com.finlens.insights.services.aggregates;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.finlens.insights.dto.insights.CategoryAggregate;
import com.finlens.insights.dto.insights.MonthlyAggregate;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.repositories.TransactionStore;
import com.finlens.insights.services.insights.CurrencyAmountResolver;
import com.finlens.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives monthly aggregates from the transaction store. Months without activity are omitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionStoreAggregateReadService implements AggregateReadService {

    private final TransactionStore transactionStore;
    private final CurrencyAmountResolver currencyAmountResolver;

    @Override
    public List<MonthlyAggregate> fetchMonthlyAggregates(LocalDate from, LocalDate to, String currency) {
        Map<YearMonth, BigDecimal[]> totals = new TreeMap<>();
        for (Transaction tx : transactionsInMonths(from, to)) {
            if (!tx.isIncome() && !tx.isExpense()) {
                continue;
            }
            BigDecimal[] slot = totals.computeIfAbsent(YearMonth.from(tx.getDate()),
                    ym -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            BigDecimal amount = currencyAmountResolver.resolve(tx, currency);
            int index = tx.isIncome() ? 0 : 1;
            slot[index] = slot[index].add(amount);
        }

        List<MonthlyAggregate> out = new ArrayList<>(totals.size());
        totals.forEach((ym, slot) -> out.add(new MonthlyAggregate(ym.getYear(), ym.getMonthValue(), slot[0], slot[1])));
        log.debug("[Aggregates] monthly from={} to={} currency={} records={}", from, to, currency, out.size());
        return out;
    }

    @Override
    public List<CategoryAggregate> fetchCategoryAggregates(LocalDate from, LocalDate to, String currency) {
        Map<YearMonth, Map<String, BigDecimal>> totals = new TreeMap<>();
        for (Transaction tx : transactionsInMonths(from, to)) {
            if (!tx.isExpense()) {
                continue;
            }
            totals.computeIfAbsent(YearMonth.from(tx.getDate()), ym -> new TreeMap<>())
                    .merge(InsightUtils.normalizeCategory(tx.getCategory()),
                            currencyAmountResolver.resolve(tx, currency), BigDecimal::add);
        }

        List<CategoryAggregate> out = new ArrayList<>();
        totals.forEach((ym, byCategory) -> byCategory.forEach((category, amount) ->
                out.add(new CategoryAggregate(ym.getYear(), ym.getMonthValue(), category, amount))));
        return out;
    }

    private List<Transaction> transactionsInMonths(LocalDate from, LocalDate to) {
        if (from == null || to == null || !from.isBefore(to)) {
            return List.of();
        }
        LocalDate firstMonth = from.withDayOfMonth(1);
        LocalDate endMonth = YearMonth.from(to.minusDays(1)).plusMonths(1).atDay(1);
        return transactionStore.listTransactions().stream()
                .filter(Objects::nonNull)
                .filter(tx -> tx.getDate() != null)
                .filter(tx -> !tx.getDate().isBefore(firstMonth) && tx.getDate().isBefore(endMonth))
                .toList();
    }
}
