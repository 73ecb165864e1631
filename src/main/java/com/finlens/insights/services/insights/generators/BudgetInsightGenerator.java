package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.BudgetItem;
import com.finlens.insights.dto.insights.InsightDetail.BudgetProgressDetail;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.services.insights.BudgetProgressCalculator;
import com.finlens.insights.services.insights.BudgetProgressCalculator.BudgetStatus;
import com.finlens.insights.services.insights.InsightContext;

import lombok.RequiredArgsConstructor;

@Component
@Order(30)
@RequiredArgsConstructor
public class BudgetInsightGenerator implements InsightGenerator {

    private static final double UNDER_UTILIZED_PERCENT = 80.0;

    private final BudgetProgressCalculator budgetProgressCalculator;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<BudgetStatus> statuses = budgetProgressCalculator.calculate(
                context.getCategories(), context.getWindowedTransactions(), context.getToday(), context.getBaseCurrency());
        if (statuses.isEmpty()) {
            return List.of();
        }

        List<Insight> out = new ArrayList<>();
        List<BudgetStatus> over = select(statuses, BudgetStatus::isOverBudget);
        if (!over.isEmpty()) {
            out.add(build("budget_over", InsightType.BUDGET_OVERSPEND, "Over budget",
                    "Spending exceeded the budget", InsightSeverity.CRITICAL, over));
        }
        List<BudgetStatus> projected = select(statuses, BudgetStatus::isProjectedOver);
        if (!projected.isEmpty()) {
            out.add(build("budget_projected_over", InsightType.PROJECTED_OVERSPEND, "Heading over budget",
                    "At the current pace these budgets will be exceeded", InsightSeverity.WARNING, projected));
        }
        List<BudgetStatus> under = select(statuses, s -> !s.isOverBudget() && !s.isProjectedOver()
                && s.percentage() > 0 && s.percentage() < UNDER_UTILIZED_PERCENT);
        if (!under.isEmpty()) {
            out.add(build("budget_under", InsightType.BUDGET_UNDERUTILIZED, "Well within budget",
                    "Less than 80% of these budgets is used", InsightSeverity.POSITIVE, under));
        }
        return out;
    }

    private static List<BudgetStatus> select(List<BudgetStatus> statuses, Predicate<BudgetStatus> filter) {
        return statuses.stream()
                .filter(filter)
                .sorted(Comparator.comparingDouble(BudgetStatus::percentage).reversed())
                .toList();
    }

    private Insight build(String id, InsightType type, String title, String subtitle,
                          InsightSeverity severity, List<BudgetStatus> items) {
        String unit = items.size() == 1 ? "category" : "categories";
        return Insight.builder()
                .id(id)
                .type(type)
                .title(title)
                .subtitle(subtitle)
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(items.size()))
                        .formattedValue(items.size() + " " + unit)
                        .unit(unit)
                        .build())
                .severity(severity)
                .category(InsightCategory.BUDGET)
                .detailData(new BudgetProgressDetail(items.stream()
                        .map(s -> new BudgetItem(s.category(), s.budgetAmount(), s.spent(), s.percentage(), s.projectedSpend()))
                        .toList()))
                .build();
    }
}
