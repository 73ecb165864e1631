package com.finlens.insights.services.insights.generators;

import static com.finlens.insights.support.InsightsTestData.expense;
import static com.finlens.insights.support.InsightsTestData.expenseCategory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.BudgetItem;
import com.finlens.insights.dto.insights.InsightDetail.BudgetProgressDetail;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.services.insights.BudgetProgressCalculator;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.support.InsightsTestData;

class BudgetInsightGeneratorTest {

    private BudgetInsightGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new BudgetInsightGenerator(new BudgetProgressCalculator(InsightsTestData.resolver()));
    }

    @Test
    @DisplayName("Splits budgets into over, projected over and under-used groups")
    void groupsBudgets() {
        InsightContext context = InsightsTestData.monthContext()
                .categories(List.of(
                        expenseCategory("Food", "100"),
                        expenseCategory("Fuel", "300"),
                        expenseCategory("Fun", "500"),
                        expenseCategory("Gym", "100"),
                        expenseCategory("Misc", null)))
                .windowedTransactions(List.of(
                        expense(LocalDate.of(2026, 4, 3), "150", "Food"),
                        expense(LocalDate.of(2026, 4, 4), "200", "fuel"),
                        expense(LocalDate.of(2026, 4, 5), "100", "Fun"),
                        expense(LocalDate.of(2026, 3, 30), "90", "Gym"),
                        expense(LocalDate.of(2026, 4, 6), "40", "Misc")))
                .build();

        List<Insight> insights = generator.generate(context);

        assertThat(insights).extracting(Insight::getId)
                .containsExactly("budget_over", "budget_projected_over", "budget_under");
        assertThat(insights).extracting(Insight::getSeverity)
                .containsExactly(InsightSeverity.CRITICAL, InsightSeverity.WARNING, InsightSeverity.POSITIVE);
        assertThat(items(insights.get(0))).extracting(BudgetItem::category).containsExactly("Food");
        BudgetItem fuel = items(insights.get(1)).get(0);
        assertThat(fuel.category()).isEqualTo("Fuel");
        assertThat(fuel.projectedSpend().doubleValue()).isCloseTo(400.0, offset(1e-6));
        assertThat(items(insights.get(2))).extracting(BudgetItem::category).containsExactly("Fun");
        assertThat(insights.get(0).getMetric().getFormattedValue()).isEqualTo("1 category");
    }

    @Test
    @DisplayName("No budget insights without budgeted categories")
    void noBudgets() {
        InsightContext context = InsightsTestData.monthContext()
                .categories(List.of(expenseCategory("Food", null)))
                .windowedTransactions(List.of(expense(LocalDate.of(2026, 4, 3), "150", "Food")))
                .build();

        assertThat(generator.generate(context)).isEmpty();
    }

    private static List<BudgetItem> items(Insight insight) {
        return ((BudgetProgressDetail) insight.getDetailData()).items();
    }
}
