package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.BudgetPeriod;
import com.finlens.insights.enums.CategoryType;

import lombok.RequiredArgsConstructor;

/**
 * Spending progress of every budgeted expense category within its current budget period.
 */
@Component
@RequiredArgsConstructor
public class BudgetProgressCalculator {

    private final CurrencyAmountResolver currencyAmountResolver;

    public record BudgetStatus(
            String category,
            BigDecimal budgetAmount,
            BigDecimal spent,
            double percentage,
            BigDecimal projectedSpend,
            LocalDate periodStart
    ) {
        public boolean isOverBudget() {
            return spent.compareTo(budgetAmount) > 0;
        }

        public boolean isProjectedOver() {
            return !isOverBudget() && projectedSpend.compareTo(budgetAmount) > 0;
        }
    }

    public List<BudgetStatus> calculate(List<Category> categories, List<Transaction> transactions,
                                        LocalDate today, String baseCurrency) {
        if (categories == null || categories.isEmpty()) {
            return List.of();
        }
        return categories.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.getType() == CategoryType.EXPENSE)
                .filter(Category::hasBudget)
                .map(c -> status(c, transactions, today, baseCurrency))
                .toList();
    }

    private BudgetStatus status(Category category, List<Transaction> transactions, LocalDate today, String baseCurrency) {
        String name = InsightUtils.normalizeCategory(category.getName());
        LocalDate periodStart = periodStart(category, today);

        Map<Boolean, BigDecimal> spentSplit = transactions.stream()
                .filter(Objects::nonNull)
                .filter(Transaction::isExpense)
                .filter(tx -> tx.getDate() != null && !tx.getDate().isBefore(periodStart) && !tx.getDate().isAfter(today))
                .collect(Collectors.partitioningBy(
                        tx -> name.toLowerCase(Locale.ROOT).equals(InsightUtils.normalizeCategory(tx.getCategory()).toLowerCase(Locale.ROOT)),
                        Collectors.reducing(BigDecimal.ZERO, tx -> currencyAmountResolver.resolve(tx, baseCurrency), BigDecimal::add)));
        BigDecimal spent = spentSplit.get(Boolean.TRUE);

        BigDecimal budget = category.getBudgetAmount();
        double percentage = spent.doubleValue() / budget.doubleValue() * 100.0;

        long daysElapsed = ChronoUnit.DAYS.between(periodStart, today) + 1;
        long totalDays = totalDays(category.getBudgetPeriod(), periodStart);
        BigDecimal projected = spent
                .divide(BigDecimal.valueOf(Math.max(1, daysElapsed)), MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(totalDays));

        return new BudgetStatus(name, budget, spent, percentage, projected, periodStart);
    }

    /** First day of the budget period that contains {@code today}. */
    public static LocalDate periodStart(Category category, LocalDate today) {
        BudgetPeriod period = category.getBudgetPeriod() != null ? category.getBudgetPeriod() : BudgetPeriod.MONTHLY;
        return switch (period) {
            case WEEKLY -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case YEARLY -> today.withDayOfYear(1);
            case MONTHLY -> {
                int resetDay = Math.max(1, Math.min(28, category.getBudgetResetDay()));
                LocalDate candidate = today.withDayOfMonth(resetDay);
                yield candidate.isAfter(today) ? candidate.minusMonths(1) : candidate;
            }
        };
    }

    private static long totalDays(BudgetPeriod period, LocalDate periodStart) {
        if (period == null) {
            period = BudgetPeriod.MONTHLY;
        }
        return switch (period) {
            case WEEKLY -> 7;
            case MONTHLY -> ChronoUnit.DAYS.between(periodStart, periodStart.plusMonths(1));
            case YEARLY -> periodStart.lengthOfYear();
        };
    }
}
