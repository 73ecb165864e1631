package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;

import lombok.RequiredArgsConstructor;

/**
 * Monthly totals of active recurring series, split by income and expense categories.
 */
@Component
@RequiredArgsConstructor
public class RecurringCostCalculator {

    private final CurrencyAmountResolver currencyAmountResolver;

    public List<RecurringSeries> activeExpenseSeries(List<RecurringSeries> series, List<Category> categories) {
        return active(series, s -> !InsightUtils.isIncomeSeries(s, categories));
    }

    public List<RecurringSeries> activeIncomeSeries(List<RecurringSeries> series, List<Category> categories) {
        return active(series, s -> InsightUtils.isIncomeSeries(s, categories));
    }

    public List<RecurringSeries> activeSubscriptions(List<RecurringSeries> series) {
        return active(series, RecurringSeries::isSubscription);
    }

    public BigDecimal monthlyTotal(List<RecurringSeries> series, String baseCurrency) {
        return series.stream()
                .map(s -> currencyAmountResolver.monthlyEquivalent(s, baseCurrency))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal monthlyExpense(List<RecurringSeries> series, List<Category> categories, String baseCurrency) {
        return monthlyTotal(activeExpenseSeries(series, categories), baseCurrency);
    }

    /** Recurring income minus recurring expenses, per month. */
    public BigDecimal monthlyNet(List<RecurringSeries> series, List<Category> categories, String baseCurrency) {
        return monthlyTotal(activeIncomeSeries(series, categories), baseCurrency)
                .subtract(monthlyExpense(series, categories, baseCurrency));
    }

    public BigDecimal monthlyEquivalent(RecurringSeries series, String baseCurrency) {
        return currencyAmountResolver.monthlyEquivalent(series, baseCurrency);
    }

    private static List<RecurringSeries> active(List<RecurringSeries> series, Predicate<RecurringSeries> filter) {
        if (series == null) {
            return List.of();
        }
        return series.stream()
                .filter(Objects::nonNull)
                .filter(RecurringSeries::isActive)
                .filter(filter)
                .toList();
    }
}
