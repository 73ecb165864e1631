package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.CategoryBreakdownDetail;
import com.finlens.insights.dto.insights.InsightDetail.CategoryShare;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.TrendDirection;
import com.finlens.insights.services.insights.CurrencyAmountResolver;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;

@Component
@Order(20)
@RequiredArgsConstructor
public class IncomeInsightGenerator implements InsightGenerator {

    private static final double GROWTH_POSITIVE_PERCENT = 10.0;
    private static final double GROWTH_WARNING_PERCENT = -10.0;
    private static final double HEALTHY_RATIO = 1.5;

    private final CurrencyAmountResolver currencyAmountResolver;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<Insight> out = new ArrayList<>();
        incomeGrowth(context).ifPresent(out::add);
        incomeVsExpense(context).ifPresent(out::add);
        incomeSources(context).ifPresent(out::add);
        return out;
    }

    Optional<Insight> incomeGrowth(InsightContext context) {
        if (context.getGranularity() == InsightGranularity.ALL_TIME) {
            return Optional.empty();
        }
        BigDecimal previous = context.previousBucket().map(PeriodBucket::getIncome).orElse(BigDecimal.ZERO);
        if (previous.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal current = context.currentBucket().map(PeriodBucket::getIncome).orElse(BigDecimal.ZERO);
        double change = InsightUtils.percentChange(current, previous);

        InsightSeverity severity;
        if (change > GROWTH_POSITIVE_PERCENT) {
            severity = InsightSeverity.POSITIVE;
        } else if (change < GROWTH_WARNING_PERCENT) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        String comparison = context.getGranularity().comparisonPeriodName();
        return Optional.of(Insight.builder()
                .id("income_growth")
                .type(InsightType.INCOME_GROWTH)
                .title("Income this " + context.getGranularity().periodNoun())
                .subtitle(formatter.signedPercent(change) + " " + comparison)
                .metric(formatter.money(current, context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .changeAbsolute(current.subtract(previous))
                        .comparisonPeriod(comparison)
                        .build())
                .severity(severity)
                .category(InsightCategory.INCOME)
                .build());
    }

    Optional<Insight> incomeVsExpense(InsightContext context) {
        PeriodSummary summary = context.getSummary();
        if (summary.totalExpenses().signum() <= 0) {
            return Optional.empty();
        }
        double ratio = summary.totalIncome().doubleValue() / summary.totalExpenses().doubleValue();

        InsightSeverity severity;
        if (ratio >= HEALTHY_RATIO) {
            severity = InsightSeverity.POSITIVE;
        } else if (ratio >= 1.0) {
            severity = InsightSeverity.NEUTRAL;
        } else {
            severity = InsightSeverity.CRITICAL;
        }

        return Optional.of(Insight.builder()
                .id("income_vs_expense")
                .type(InsightType.INCOME_VS_EXPENSE_RATIO)
                .title("Income vs expenses")
                .subtitle("Net " + formatter.currency(summary.netFlow(), context.getBaseCurrency()))
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(ratio))
                        .formattedValue(formatter.ratio(ratio))
                        .unit("ratio")
                        .build())
                .trend(InsightTrend.builder()
                        .direction(ratio >= 1.0 ? TrendDirection.UP : TrendDirection.DOWN)
                        .changeAbsolute(summary.netFlow())
                        .comparisonPeriod("income vs expenses")
                        .build())
                .severity(severity)
                .category(InsightCategory.INCOME)
                .build());
    }

    Optional<Insight> incomeSources(InsightContext context) {
        Map<String, BigDecimal> bySource = new LinkedHashMap<>();
        for (Transaction tx : context.getWindowedTransactions()) {
            if (tx == null || !tx.isIncome()) {
                continue;
            }
            bySource.merge(InsightUtils.normalizeCategory(tx.getCategory()),
                    currencyAmountResolver.resolve(tx, context.getBaseCurrency()), BigDecimal::add);
        }
        if (bySource.size() < 2) {
            return Optional.empty();
        }
        BigDecimal total = InsightUtils.sum(new ArrayList<>(bySource.values()));
        if (total.signum() <= 0) {
            return Optional.empty();
        }
        List<CategoryShare> shares = bySource.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .map(e -> new CategoryShare(e.getKey(), e.getValue(), e.getValue().doubleValue() / total.doubleValue() * 100.0))
                .toList();

        return Optional.of(Insight.builder()
                .id("income_sources")
                .type(InsightType.INCOME_SOURCE_BREAKDOWN)
                .title("Income sources")
                .subtitle(shares.size() + " sources, led by " + shares.get(0).category())
                .metric(formatter.money(total, context.getBaseCurrency()))
                .severity(InsightSeverity.NEUTRAL)
                .category(InsightCategory.INCOME)
                .detailData(new CategoryBreakdownDetail(shares))
                .build());
    }
}
