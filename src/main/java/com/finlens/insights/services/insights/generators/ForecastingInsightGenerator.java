package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.MonthlyAggregate;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.RecurringFrequency;
import com.finlens.insights.enums.TrendDirection;
import com.finlens.insights.services.aggregates.AggregateReadService;
import com.finlens.insights.services.insights.CurrencyAmountResolver;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;
import com.finlens.insights.services.insights.RecurringCostCalculator;

import lombok.RequiredArgsConstructor;

@Component
@Order(80)
@RequiredArgsConstructor
public class ForecastingInsightGenerator implements InsightGenerator {

    private static final int TRAILING_DAYS = 30;
    private static final int RUNWAY_MONTHS = 3;
    private static final double RUNWAY_POSITIVE_MONTHS = 3.0;
    private static final double RUNWAY_WARNING_MONTHS = 1.0;
    private static final double YOY_MIN_CHANGE = 3.0;
    private static final double YOY_POSITIVE = -10.0;
    private static final double YOY_WARNING = 15.0;
    private static final int VELOCITY_MIN_DAY = 3;
    private static final double VELOCITY_MIN_DEVIATION = 0.1;
    private static final double VELOCITY_WARNING = 1.3;
    private static final double VELOCITY_POSITIVE = 0.8;
    private static final int SEASONALITY_MONTHS = 24;
    private static final int SEASONALITY_MIN_RECORDS = 12;
    private static final int SEASONALITY_MIN_DISTINCT_MONTHS = 6;
    private static final double SEASONALITY_PEAK_FACTOR = 1.1;

    private final AggregateReadService aggregateReadService;
    private final CurrencyAmountResolver currencyAmountResolver;
    private final RecurringCostCalculator recurringCostCalculator;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<Insight> out = new ArrayList<>();
        spendingForecast(context).ifPresent(out::add);
        balanceRunway(context).ifPresent(out::add);
        yearOverYear(context).ifPresent(out::add);
        spendingVelocity(context).ifPresent(out::add);
        incomeSeasonality(context).ifPresent(out::add);
        return out;
    }

    /**
     * Month-end spending: spent so far, plus the trailing 30-day daily average for the remaining days,
     * plus monthly recurring payments still due this month.
     */
    Optional<Insight> spendingForecast(InsightContext context) {
        LocalDate today = context.getToday();
        LocalDate monthStart = today.withDayOfMonth(1);
        String currency = context.getBaseCurrency();

        BigDecimal spentSoFar = sum(context.getAllTransactions(), monthStart, today, false, currency);
        BigDecimal trailing = sum(context.getAllTransactions(), today.minusDays(TRAILING_DAYS - 1L), today, false, currency);
        if (spentSoFar.signum() <= 0 && trailing.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal avgDaily = trailing.divide(BigDecimal.valueOf(TRAILING_DAYS), MathContext.DECIMAL64);
        int daysRemaining = today.lengthOfMonth() - today.getDayOfMonth();

        BigDecimal pendingRecurring = recurringCostCalculator
                .activeExpenseSeries(context.getRecurringSeries(), context.getCategories()).stream()
                .filter(s -> s.getFrequency() == RecurringFrequency.MONTHLY)
                .filter(s -> s.getStartDate() != null && s.getStartDate().getDayOfMonth() > today.getDayOfMonth())
                .map(s -> recurringCostCalculator.monthlyEquivalent(s, currency))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal forecast = spentSoFar
                .add(avgDaily.multiply(BigDecimal.valueOf(daysRemaining)))
                .add(pendingRecurring);
        BigDecimal income = sum(context.getAllTransactions(), monthStart, today, true, currency);

        InsightSeverity severity;
        if (income.signum() <= 0) {
            severity = InsightSeverity.NEUTRAL;
        } else if (forecast.compareTo(income) > 0) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.POSITIVE;
        }

        return Optional.of(Insight.builder()
                .id("spending_forecast")
                .type(InsightType.SPENDING_FORECAST)
                .title("Month-end spending forecast")
                .subtitle(formatter.days(daysRemaining) + " left this month")
                .metric(formatter.money(forecast, currency))
                .trend(InsightTrend.builder()
                        .direction(TrendDirection.UP)
                        .changeAbsolute(forecast.subtract(spentSoFar))
                        .comparisonPeriod("vs spent so far")
                        .build())
                .severity(severity)
                .category(InsightCategory.FORECASTING)
                .build());
    }

    Optional<Insight> balanceRunway(InsightContext context) {
        BigDecimal balance = context.totalBalance();
        if (balance.signum() <= 0) {
            return Optional.empty();
        }
        List<MonthlyAggregate> recent = lastAggregates(context, RUNWAY_MONTHS);
        if (recent.isEmpty()) {
            return Optional.empty();
        }
        double averageNet = InsightUtils.mean(recent.stream().map(MonthlyAggregate::netFlow).toList());
        String currency = context.getBaseCurrency();

        if (averageNet >= 0) {
            return Optional.of(Insight.builder()
                    .id("balance_runway")
                    .type(InsightType.BALANCE_RUNWAY)
                    .title("Balance runway")
                    .subtitle("Balance is growing each month")
                    .metric(formatter.money(BigDecimal.valueOf(averageNet), currency))
                    .severity(InsightSeverity.POSITIVE)
                    .category(InsightCategory.FORECASTING)
                    .build());
        }

        double runway = balance.doubleValue() / Math.abs(averageNet);
        InsightSeverity severity;
        if (runway >= RUNWAY_POSITIVE_MONTHS) {
            severity = InsightSeverity.POSITIVE;
        } else if (runway >= RUNWAY_WARNING_MONTHS) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.CRITICAL;
        }
        return Optional.of(Insight.builder()
                .id("balance_runway")
                .type(InsightType.BALANCE_RUNWAY)
                .title("Balance runway")
                .subtitle("At the current monthly deficit")
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(runway))
                        .formattedValue(formatter.months(runway))
                        .unit("months")
                        .build())
                .severity(severity)
                .category(InsightCategory.FORECASTING)
                .build());
    }

    Optional<Insight> yearOverYear(InsightContext context) {
        LocalDate monthStart = context.getToday().withDayOfMonth(1);
        LocalDate lastYearStart = monthStart.minusYears(1);
        String currency = context.getBaseCurrency();

        BigDecimal current = expensesOf(aggregateReadService.fetchMonthlyAggregates(
                monthStart, context.getToday().plusDays(1), currency));
        BigDecimal lastYear = expensesOf(aggregateReadService.fetchMonthlyAggregates(
                lastYearStart, lastYearStart.plusMonths(1), currency));
        if (lastYear.signum() <= 0) {
            return Optional.empty();
        }
        double change = InsightUtils.percentChange(current, lastYear);
        if (Math.abs(change) <= YOY_MIN_CHANGE) {
            return Optional.empty();
        }

        InsightSeverity severity;
        if (change <= YOY_POSITIVE) {
            severity = InsightSeverity.POSITIVE;
        } else if (change >= YOY_WARNING) {
            severity = InsightSeverity.WARNING;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        return Optional.of(Insight.builder()
                .id("year_over_year")
                .type(InsightType.YEAR_OVER_YEAR)
                .title("Spending vs a year ago")
                .subtitle(formatter.signedPercent(change) + " vs same month last year")
                .metric(formatter.money(current, currency))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .changeAbsolute(current.subtract(lastYear))
                        .comparisonPeriod("vs same month last year")
                        .build())
                .severity(severity)
                .category(InsightCategory.FORECASTING)
                .build());
    }

    /**
     * Daily spending pace of the current month against last month's.
     */
    Optional<Insight> spendingVelocity(InsightContext context) {
        LocalDate today = context.getToday();
        int dayOfMonth = today.getDayOfMonth();
        if (dayOfMonth <= VELOCITY_MIN_DAY) {
            return Optional.empty();
        }
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate lastMonthStart = monthStart.minusMonths(1);
        String currency = context.getBaseCurrency();

        BigDecimal lastMonth = expensesOf(aggregateReadService.fetchMonthlyAggregates(lastMonthStart, monthStart, currency));
        if (lastMonth.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal spentSoFar = sum(context.getAllTransactions(), monthStart, today, false, currency);
        double currentDaily = spentSoFar.doubleValue() / dayOfMonth;
        double lastDaily = lastMonth.doubleValue() / lastMonthStart.lengthOfMonth();
        double ratio = currentDaily / lastDaily;
        if (Math.abs(ratio - 1.0) <= VELOCITY_MIN_DEVIATION) {
            return Optional.empty();
        }

        InsightSeverity severity;
        if (ratio > VELOCITY_WARNING) {
            severity = InsightSeverity.WARNING;
        } else if (ratio < VELOCITY_POSITIVE) {
            severity = InsightSeverity.POSITIVE;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        double change = (ratio - 1.0) * 100.0;
        return Optional.of(Insight.builder()
                .id("spending_velocity")
                .type(InsightType.SPENDING_VELOCITY)
                .title("Spending pace")
                .subtitle(formatter.ratio(ratio) + " last month's daily pace")
                .metric(InsightMetric.builder()
                        .value(BigDecimal.valueOf(ratio))
                        .formattedValue(formatter.ratio(ratio))
                        .unit("ratio")
                        .build())
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .comparisonPeriod("vs last month")
                        .build())
                .severity(severity)
                .category(InsightCategory.FORECASTING)
                .build());
    }

    Optional<Insight> incomeSeasonality(InsightContext context) {
        DateWindow window = InsightUtils.lastMonths(context.getToday(), SEASONALITY_MONTHS);
        List<MonthlyAggregate> records = aggregateReadService.fetchMonthlyAggregates(
                window.start(), window.end(), context.getBaseCurrency());
        if (records.size() < SEASONALITY_MIN_RECORDS) {
            return Optional.empty();
        }

        Map<Month, List<BigDecimal>> byMonth = new EnumMap<>(Month.class);
        for (MonthlyAggregate record : records) {
            if (record.totalIncome().signum() > 0) {
                byMonth.computeIfAbsent(Month.of(record.month()), m -> new ArrayList<>()).add(record.totalIncome());
            }
        }
        if (byMonth.size() < SEASONALITY_MIN_DISTINCT_MONTHS) {
            return Optional.empty();
        }

        Map<Month, Double> averages = new EnumMap<>(Month.class);
        byMonth.forEach((month, values) -> averages.put(month, InsightUtils.mean(values)));
        double overall = averages.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        Map.Entry<Month, Double> peak = averages.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        if (overall <= 0 || peak.getValue() <= overall * SEASONALITY_PEAK_FACTOR) {
            return Optional.empty();
        }

        double above = (peak.getValue() / overall - 1.0) * 100.0;
        String monthName = peak.getKey().getDisplayName(TextStyle.FULL, formatter.getLocale());
        return Optional.of(Insight.builder()
                .id("income_seasonality")
                .type(InsightType.INCOME_SEASONALITY)
                .title("Income peaks in " + monthName)
                .subtitle(formatter.percent(above) + " above your monthly average")
                .metric(formatter.money(BigDecimal.valueOf(peak.getValue()), context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(TrendDirection.UP)
                        .changePercent(above)
                        .comparisonPeriod("vs monthly average")
                        .build())
                .severity(InsightSeverity.NEUTRAL)
                .category(InsightCategory.FORECASTING)
                .build());
    }

    private BigDecimal sum(List<Transaction> transactions, LocalDate from, LocalDate toInclusive,
                           boolean income, String currency) {
        BigDecimal total = BigDecimal.ZERO;
        for (Transaction tx : transactions) {
            if (tx == null || tx.getDate() == null || tx.getDate().isBefore(from) || tx.getDate().isAfter(toInclusive)) {
                continue;
            }
            if (income ? tx.isIncome() : tx.isExpense()) {
                total = total.add(currencyAmountResolver.resolve(tx, currency));
            }
        }
        return total;
    }

    private List<MonthlyAggregate> lastAggregates(InsightContext context, int months) {
        DateWindow window = InsightUtils.lastMonths(context.getToday(), months);
        List<MonthlyAggregate> records = aggregateReadService.fetchMonthlyAggregates(
                window.start(), window.end(), context.getBaseCurrency());
        return records.size() <= months ? records : records.subList(records.size() - months, records.size());
    }

    private static BigDecimal expensesOf(List<MonthlyAggregate> records) {
        return records.stream().map(MonthlyAggregate::totalExpenses).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
