package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Service;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.FinancialHealthScore;
import com.finlens.insights.dto.insights.MonthlyAggregate;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.services.aggregates.AggregateReadService;
import com.finlens.insights.services.insights.BudgetProgressCalculator.BudgetStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Weighted 0-100 score over savings rate, budget adherence, recurring burden, emergency fund and cash flow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthScoreService {

    static final double WEIGHT_SAVINGS = 0.30;
    static final double WEIGHT_BUDGET = 0.25;
    static final double WEIGHT_RECURRING = 0.20;
    static final double WEIGHT_EMERGENCY = 0.15;
    static final double WEIGHT_CASHFLOW = 0.10;

    private static final double TARGET_SAVINGS_RATE = 20.0;
    private static final double TARGET_EMERGENCY_MONTHS = 6.0;
    private static final double NO_BUDGET_SCORE = 50.0;
    private static final int EMERGENCY_AVERAGE_MONTHS = 3;

    private final BudgetProgressCalculator budgetProgressCalculator;
    private final RecurringCostCalculator recurringCostCalculator;
    private final AggregateReadService aggregateReadService;

    public FinancialHealthScore compute(InsightContext context) {
        BigDecimal income = context.getSummary().totalIncome();
        if (income.signum() <= 0) {
            return FinancialHealthScore.unavailable();
        }
        BigDecimal expenses = context.getSummary().totalExpenses();
        String currency = context.getBaseCurrency();

        double savingsRate = income.subtract(expenses).doubleValue() / income.doubleValue() * 100.0;
        double savingsScore = InsightUtils.clamp(savingsRate / TARGET_SAVINGS_RATE * 100.0, 0, 100);

        List<BudgetStatus> budgets = budgetProgressCalculator.calculate(
                context.getCategories(), context.getWindowedTransactions(), context.getToday(), currency);
        double budgetScore = budgets.isEmpty()
                ? NO_BUDGET_SCORE
                : budgets.stream().filter(b -> !b.isOverBudget()).count() * 100.0 / budgets.size();

        BigDecimal recurring = recurringCostCalculator.monthlyExpense(
                context.getRecurringSeries(), context.getCategories(), currency);
        double recurringScore = InsightUtils.clamp(
                (1.0 - recurring.doubleValue() / Math.max(income.doubleValue(), 1.0)) * 100.0, 0, 100);

        double emergencyScore = emergencyScore(context, expenses);

        double cashflowScore = latestNetFlow(context).signum() > 0 ? 100.0 : 0.0;

        double total = savingsScore * WEIGHT_SAVINGS
                + budgetScore * WEIGHT_BUDGET
                + recurringScore * WEIGHT_RECURRING
                + emergencyScore * WEIGHT_EMERGENCY
                + cashflowScore * WEIGHT_CASHFLOW;
        int score = (int) Math.round(InsightUtils.clamp(total, 0, 100));

        log.debug("[HealthScore] savings={} budget={} recurring={} emergency={} cashflow={} total={}",
                savingsScore, budgetScore, recurringScore, emergencyScore, cashflowScore, score);

        return FinancialHealthScore.builder()
                .score(score)
                .grade(grade(score))
                .savingsRateScore((int) Math.round(savingsScore))
                .budgetAdherenceScore((int) Math.round(budgetScore))
                .recurringRatioScore((int) Math.round(recurringScore))
                .emergencyFundScore((int) Math.round(emergencyScore))
                .cashflowScore((int) Math.round(cashflowScore))
                .build();
    }

    static String grade(int score) {
        if (score >= 80) {
            return "Excellent";
        }
        if (score >= 60) {
            return "Good";
        }
        if (score >= 40) {
            return "Fair";
        }
        return "Needs attention";
    }

    private double emergencyScore(InsightContext context, BigDecimal windowExpenses) {
        BigDecimal balance = context.totalBalance();
        if (balance.signum() <= 0) {
            return 0.0;
        }
        DateWindow window = InsightUtils.lastMonths(context.getToday(), EMERGENCY_AVERAGE_MONTHS);
        List<MonthlyAggregate> recent = aggregateReadService.fetchMonthlyAggregates(
                window.start(), window.end(), context.getBaseCurrency());
        double averageExpenses = InsightUtils.mean(recent.stream().map(MonthlyAggregate::totalExpenses).toList());
        if (averageExpenses <= 0) {
            // no aggregates yet: spread the window's expenses over a year
            averageExpenses = windowExpenses.doubleValue() / 12.0;
        }
        if (averageExpenses <= 0) {
            return 100.0;
        }
        double months = balance.doubleValue() / averageExpenses;
        return InsightUtils.clamp(months / TARGET_EMERGENCY_MONTHS * 100.0, 0, 100);
    }

    private static BigDecimal latestNetFlow(InsightContext context) {
        List<PeriodBucket> buckets = context.getBuckets();
        if (buckets == null || buckets.isEmpty()) {
            return context.getSummary().netFlow();
        }
        return context.currentBucket().orElse(buckets.get(buckets.size() - 1)).getNetFlow();
    }
}
