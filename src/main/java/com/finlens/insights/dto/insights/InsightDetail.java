package com.finlens.insights.dto.insights;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Optional drill-down payload attached to an {@link Insight}.
 */
public interface InsightDetail {

    record CategoryShare(String category, BigDecimal amount, double percentage) {
    }

    record CategoryBreakdownDetail(List<CategoryShare> items) implements InsightDetail {
    }

    record PeriodTrendDetail(List<PeriodBucket> periods) implements InsightDetail {
    }

    record BudgetItem(String category, BigDecimal budgetAmount, BigDecimal spent, double percentage,
                      BigDecimal projectedSpend) {
    }

    record BudgetProgressDetail(List<BudgetItem> items) implements InsightDetail {
    }

    record RecurringItem(String id, String description, String category, BigDecimal monthlyAmount) {
    }

    record RecurringListDetail(List<RecurringItem> items) implements InsightDetail {
    }

    record AccountItem(String id, String name, BigDecimal balance, LocalDate lastActivity) {
    }

    record AccountListDetail(List<AccountItem> items) implements InsightDetail {
    }
}
