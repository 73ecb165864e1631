package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.MonthlyAggregate;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.services.aggregates.AggregateReadService;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;

@Component
@Order(70)
@RequiredArgsConstructor
public class SavingsInsightGenerator implements InsightGenerator {

    private static final double RATE_POSITIVE_PERCENT = 20.0;
    private static final double RATE_WARNING_PERCENT = 10.0;
    private static final int EMERGENCY_MONTHS = 3;
    private static final double EMERGENCY_POSITIVE_MONTHS = 3.0;
    private static final double EMERGENCY_WARNING_MONTHS = 1.0;
    private static final int MOMENTUM_MONTHS = 4;
    private static final double MOMENTUM_MIN_DELTA = 1.0;
    private static final double MOMENTUM_BAND = 2.0;

    private final AggregateReadService aggregateReadService;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<Insight> out = new ArrayList<>();
        savingsRate(context).ifPresent(out::add);
        emergencyFund(context).ifPresent(out::add);
        savingsMomentum(context).ifPresent(out::add);
        return out;
    }

    Optional<Insight> savingsRate(InsightContext context) {
        PeriodSummary summary = context.getSummary();
        if (summary.totalIncome().signum() <= 0) {
            return Optional.empty();
        }
        double rate = rate(summary.totalIncome(), summary.totalExpenses());

        InsightSeverity severity;
        if (rate > RATE_POSITIVE_PERCENT) {
            severity = InsightSeverity.POSITIVE;
        } else if (rate >= RATE_WARNING_PERCENT) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.CRITICAL;
        }

        return Optional.of(Insight.builder()
                .id("savings_rate")
                .type(InsightType.SAVINGS_RATE)
                .title("Savings rate")
                .subtitle(formatter.currency(summary.netFlow(), context.getBaseCurrency()) + " saved")
                .metric(percentMetric(rate))
                .severity(severity)
                .category(InsightCategory.SAVINGS)
                .build());
    }

    Optional<Insight> emergencyFund(InsightContext context) {
        BigDecimal balance = context.totalBalance();
        if (balance.signum() <= 0) {
            return Optional.empty();
        }
        List<MonthlyAggregate> recent = lastAggregates(context, EMERGENCY_MONTHS);
        double averageExpenses = InsightUtils.mean(recent.stream().map(MonthlyAggregate::totalExpenses).toList());
        if (averageExpenses <= 0) {
            return Optional.empty();
        }
        double months = balance.doubleValue() / averageExpenses;

        InsightSeverity severity;
        if (months >= EMERGENCY_POSITIVE_MONTHS) {
            severity = InsightSeverity.POSITIVE;
        } else if (months >= EMERGENCY_WARNING_MONTHS) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.CRITICAL;
        }

        return Optional.of(Insight.builder()
                .id("emergency_fund")
                .type(InsightType.EMERGENCY_FUND)
                .title("Emergency fund")
                .subtitle("Covers average monthly expenses")
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(months))
                        .formattedValue(formatter.months(months))
                        .unit("months")
                        .build())
                .severity(severity)
                .category(InsightCategory.SAVINGS)
                .build());
    }

    /**
     * Latest monthly savings rate against the average of the months before it.
     */
    Optional<Insight> savingsMomentum(InsightContext context) {
        List<MonthlyAggregate> recent = lastAggregates(context, MOMENTUM_MONTHS);
        if (recent.size() < 2) {
            return Optional.empty();
        }
        List<Double> rates = recent.stream()
                .map(a -> a.totalIncome().signum() > 0 ? rate(a.totalIncome(), a.totalExpenses()) : 0.0)
                .toList();
        double current = rates.get(rates.size() - 1);
        double previousAverage = rates.subList(0, rates.size() - 1).stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        double delta = current - previousAverage;
        if (Math.abs(delta) <= MOMENTUM_MIN_DELTA) {
            return Optional.empty();
        }

        InsightSeverity severity;
        if (delta > MOMENTUM_BAND) {
            severity = InsightSeverity.POSITIVE;
        } else if (delta < -MOMENTUM_BAND) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        return Optional.of(Insight.builder()
                .id("savings_momentum")
                .type(InsightType.SAVINGS_MOMENTUM)
                .title("Savings momentum")
                .subtitle(String.format(formatter.getLocale(), "%+.1f pts vs recent average", delta))
                .metric(percentMetric(current))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(delta))
                        .changePercent(delta)
                        .comparisonPeriod("vs previous " + (rates.size() - 1) + " months")
                        .build())
                .severity(severity)
                .category(InsightCategory.SAVINGS)
                .build());
    }

    private List<MonthlyAggregate> lastAggregates(InsightContext context, int months) {
        DateWindow window = InsightUtils.lastMonths(context.getToday(), months);
        List<MonthlyAggregate> records = aggregateReadService.fetchMonthlyAggregates(
                window.start(), window.end(), context.getBaseCurrency());
        if (records.size() <= months) {
            return records;
        }
        return records.subList(records.size() - months, records.size());
    }

    private static double rate(BigDecimal income, BigDecimal expenses) {
        return income.subtract(expenses).doubleValue() / income.doubleValue() * 100.0;
    }

    private InsightMetric percentMetric(double value) {
        return InsightMetric.builder()
                .value(BigDecimal.valueOf(value))
                .formattedValue(formatter.percent(value))
                .unit("%")
                .build();
    }
}
