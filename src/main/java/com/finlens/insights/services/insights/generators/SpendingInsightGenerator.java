package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.CategoryAggregate;
import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.CategoryBreakdownDetail;
import com.finlens.insights.dto.insights.InsightDetail.CategoryShare;
import com.finlens.insights.dto.insights.InsightMetric;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.TrendDirection;
import com.finlens.insights.services.aggregates.AggregateReadService;
import com.finlens.insights.services.insights.CurrencyAmountResolver;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@Order(10)
@RequiredArgsConstructor
public class SpendingInsightGenerator implements InsightGenerator {

    private static final double HIGH_SHARE_PERCENT = 50.0;
    private static final double CHANGE_WARNING_PERCENT = 20.0;
    private static final double CHANGE_POSITIVE_PERCENT = -10.0;
    private static final int BREAKDOWN_SIZE = 5;

    static final int SPIKE_HISTORY_MONTHS = 3;
    static final BigDecimal SPIKE_MIN_AVERAGE = BigDecimal.valueOf(100);
    static final double SPIKE_MULTIPLIER = 1.5;
    static final double SPIKE_CRITICAL_MULTIPLIER = 2.0;

    private static final int TREND_MONTHS = 6;
    private static final int TREND_MIN_MONTHS = 4;
    private static final int TREND_MIN_POINTS = 3;
    private static final int TREND_MIN_STREAK = 2;

    private final AggregateReadService aggregateReadService;
    private final CurrencyAmountResolver currencyAmountResolver;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<Insight> out = new ArrayList<>();
        topSpendingCategory(context).ifPresent(out::add);
        periodOverPeriodChange(context).ifPresent(out::add);
        averageDailySpending(context).ifPresent(out::add);
        spendingSpike(context).ifPresent(out::add);
        categoryTrend(context).ifPresent(out::add);
        return out;
    }

    Optional<Insight> topSpendingCategory(InsightContext context) {
        Map<String, BigDecimal> totals = categoryTotalsForCurrentPeriod(context);
        if (totals.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = InsightUtils.sum(new ArrayList<>(totals.values()));
        if (total.signum() <= 0) {
            return Optional.empty();
        }
        Map.Entry<String, BigDecimal> top = totals.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        double share = share(top.getValue(), total);

        List<CategoryShare> breakdown = totals.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .limit(BREAKDOWN_SIZE)
                .map(e -> new CategoryShare(e.getKey(), e.getValue(), share(e.getValue(), total)))
                .toList();

        return Optional.of(Insight.builder()
                .id("top_spending_" + top.getKey())
                .type(InsightType.TOP_SPENDING_CATEGORY)
                .title("Top spending category")
                .subtitle(String.format("%s · %s of spending", top.getKey(), formatter.percent(share)))
                .metric(formatter.money(top.getValue(), context.getBaseCurrency()))
                .severity(share > HIGH_SHARE_PERCENT ? InsightSeverity.WARNING : InsightSeverity.NEUTRAL)
                .category(InsightCategory.SPENDING)
                .detailData(new CategoryBreakdownDetail(breakdown))
                .build());
    }

    Optional<Insight> periodOverPeriodChange(InsightContext context) {
        if (context.getGranularity() == InsightGranularity.ALL_TIME) {
            return Optional.empty();
        }
        Optional<PeriodBucket> previous = context.previousBucket();
        if (previous.isEmpty() || previous.get().getExpenses().signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal current = context.currentBucket().map(PeriodBucket::getExpenses).orElse(BigDecimal.ZERO);
        BigDecimal prev = previous.get().getExpenses();
        double change = InsightUtils.percentChange(current, prev);

        InsightSeverity severity;
        if (change > CHANGE_WARNING_PERCENT) {
            severity = InsightSeverity.WARNING;
        } else if (change < CHANGE_POSITIVE_PERCENT) {
            severity = InsightSeverity.POSITIVE;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        return Optional.of(Insight.builder()
                .id("mom_spending")
                .type(InsightType.MONTH_OVER_MONTH_CHANGE)
                .title("Spending this " + context.getGranularity().periodNoun())
                .subtitle(formatter.signedPercent(change) + " " + context.getGranularity().comparisonPeriodName())
                .metric(formatter.money(current, context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .changeAbsolute(current.subtract(prev))
                        .comparisonPeriod(context.getGranularity().comparisonPeriodName())
                        .build())
                .severity(severity)
                .category(InsightCategory.SPENDING)
                .build());
    }

    Optional<Insight> averageDailySpending(InsightContext context) {
        LocalDate from;
        LocalDate to;
        BigDecimal expenses;
        Optional<PeriodBucket> current = context.currentBucket();
        if (current.isPresent()) {
            from = current.get().getPeriodStart();
            to = current.get().getPeriodEnd();
            expenses = current.get().getExpenses();
        } else {
            from = context.getWindow().start();
            to = context.getWindow().end();
            expenses = context.getSummary().totalExpenses();
        }
        if (expenses.signum() <= 0) {
            return Optional.empty();
        }
        LocalDate elapsedEnd = to.isAfter(context.getToday().plusDays(1)) ? context.getToday().plusDays(1) : to;
        long days = Math.max(1, ChronoUnit.DAYS.between(from, elapsedEnd));
        BigDecimal daily = expenses.divide(BigDecimal.valueOf(days), MathContext.DECIMAL64);

        return Optional.of(Insight.builder()
                .id("avg_daily")
                .type(InsightType.AVERAGE_DAILY_SPENDING)
                .title("Average daily spending")
                .subtitle("Over " + formatter.days(days))
                .metric(InsightMetric.builder()
                        .value(daily)
                        .formattedValue(formatter.currency(daily, context.getBaseCurrency()))
                        .currency(context.getBaseCurrency())
                        .unit("per day")
                        .build())
                .severity(InsightSeverity.NEUTRAL)
                .category(InsightCategory.SPENDING)
                .build());
    }

    /**
     * Flags the category whose current-month spending exceeds its recent monthly average the most.
     * Categories with a small average are ignored so that tiny amounts never read as spikes.
     */
    Optional<Insight> spendingSpike(InsightContext context) {
        LocalDate monthStart = context.getToday().withDayOfMonth(1);
        String currency = context.getBaseCurrency();
        List<CategoryAggregate> history = aggregateReadService.fetchCategoryAggregates(
                monthStart.minusMonths(SPIKE_HISTORY_MONTHS), monthStart, currency);
        List<CategoryAggregate> current = aggregateReadService.fetchCategoryAggregates(
                monthStart, context.getToday().plusDays(1), currency);
        if (history.isEmpty() || current.isEmpty()) {
            return Optional.empty();
        }

        Map<String, List<BigDecimal>> historyByCategory = history.stream()
                .collect(Collectors.groupingBy(CategoryAggregate::categoryName,
                        Collectors.mapping(CategoryAggregate::totalExpenses, Collectors.toList())));
        Map<String, BigDecimal> currentByCategory = sumByCategory(current);

        String bestCategory = null;
        double bestMultiplier = 0.0;
        BigDecimal bestAmount = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : currentByCategory.entrySet()) {
            List<BigDecimal> past = historyByCategory.get(entry.getKey());
            if (entry.getValue().signum() <= 0 || past == null || past.isEmpty()) {
                continue;
            }
            double average = InsightUtils.mean(past);
            if (average <= SPIKE_MIN_AVERAGE.doubleValue()) {
                continue;
            }
            double multiplier = entry.getValue().doubleValue() / average;
            if (multiplier > SPIKE_MULTIPLIER && multiplier > bestMultiplier) {
                bestMultiplier = multiplier;
                bestCategory = entry.getKey();
                bestAmount = entry.getValue();
            }
        }
        if (bestCategory == null) {
            return Optional.empty();
        }

        log.debug("[SpendingInsights] spike category={} multiplier={}", bestCategory, bestMultiplier);
        return Optional.of(Insight.builder()
                .id("spending_spike_" + bestCategory)
                .type(InsightType.SPENDING_SPIKE)
                .title("Spending spike")
                .subtitle(String.format("%s is %s your usual monthly level", bestCategory, formatter.ratio(bestMultiplier)))
                .metric(formatter.money(bestAmount, context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(TrendDirection.UP)
                        .changePercent((bestMultiplier - 1.0) * 100.0)
                        .comparisonPeriod("vs 3-month average")
                        .build())
                .severity(bestMultiplier > SPIKE_CRITICAL_MULTIPLIER ? InsightSeverity.CRITICAL : InsightSeverity.WARNING)
                .category(InsightCategory.SPENDING)
                .build());
    }

    /**
     * Finds the category with the longest run of consecutive monthly increases ending in the latest month.
     */
    Optional<Insight> categoryTrend(InsightContext context) {
        DateWindow window = InsightUtils.lastMonths(context.getToday(), TREND_MONTHS);
        List<CategoryAggregate> records = aggregateReadService.fetchCategoryAggregates(
                window.start(), window.end(), context.getBaseCurrency());
        long months = records.stream().map(CategoryAggregate::monthStart).distinct().count();
        if (months < TREND_MIN_MONTHS) {
            return Optional.empty();
        }

        Map<String, TreeMap<LocalDate, BigDecimal>> series = new HashMap<>();
        for (CategoryAggregate record : records) {
            series.computeIfAbsent(record.categoryName(), k -> new TreeMap<>())
                    .merge(record.monthStart(), record.totalExpenses(), BigDecimal::add);
        }

        String bestCategory = null;
        int bestStreak = 0;
        List<BigDecimal> bestValues = List.of();
        for (Map.Entry<String, TreeMap<LocalDate, BigDecimal>> entry : series.entrySet()) {
            List<BigDecimal> values = new ArrayList<>(entry.getValue().values());
            if (values.size() < TREND_MIN_POINTS) {
                continue;
            }
            int streak = 0;
            for (int i = values.size() - 1; i > 0; i--) {
                if (values.get(i).compareTo(values.get(i - 1)) > 0) {
                    streak++;
                } else {
                    break;
                }
            }
            if (streak >= TREND_MIN_STREAK && streak > bestStreak) {
                bestStreak = streak;
                bestCategory = entry.getKey();
                bestValues = values;
            }
        }
        if (bestCategory == null) {
            return Optional.empty();
        }

        BigDecimal latest = bestValues.get(bestValues.size() - 1);
        BigDecimal base = bestValues.get(bestValues.size() - 1 - bestStreak);
        double change = InsightUtils.percentChange(latest, base);
        return Optional.of(Insight.builder()
                .id("category_trend_" + bestCategory)
                .type(InsightType.CATEGORY_TREND)
                .title("Rising category")
                .subtitle(String.format("%s up %d months in a row", bestCategory, bestStreak))
                .metric(formatter.money(latest, context.getBaseCurrency()))
                .trend(InsightTrend.builder()
                        .direction(TrendDirection.UP)
                        .changePercent(change)
                        .changeAbsolute(latest.subtract(base))
                        .comparisonPeriod("over " + bestStreak + " months")
                        .build())
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.SPENDING)
                .build());
    }

    private Map<String, BigDecimal> categoryTotalsForCurrentPeriod(InsightContext context) {
        Optional<PeriodBucket> current = context.currentBucket();
        if (current.isPresent() && isMonthAligned(current.get().getPeriodStart(), current.get().getPeriodEnd())) {
            List<CategoryAggregate> aggregates = aggregateReadService.fetchCategoryAggregates(
                    current.get().getPeriodStart(), current.get().getPeriodEnd(), context.getBaseCurrency());
            if (!aggregates.isEmpty()) {
                return sumByCategory(aggregates);
            }
        }
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (Transaction tx : context.currentPeriodTransactions()) {
            if (tx == null || !tx.isExpense()) {
                continue;
            }
            totals.merge(InsightUtils.normalizeCategory(tx.getCategory()),
                    currencyAmountResolver.resolve(tx, context.getBaseCurrency()), BigDecimal::add);
        }
        return totals;
    }

    private static Map<String, BigDecimal> sumByCategory(List<CategoryAggregate> aggregates) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        aggregates.stream()
                .filter(Objects::nonNull)
                .forEach(a -> out.merge(a.categoryName(), InsightUtils.nullToZero(a.totalExpenses()), BigDecimal::add));
        return out;
    }

    private static boolean isMonthAligned(LocalDate start, LocalDate end) {
        return start.getDayOfMonth() == 1 && end.getDayOfMonth() == 1;
    }

    private static double share(BigDecimal part, BigDecimal total) {
        return part.doubleValue() / total.doubleValue() * 100.0;
    }
}
