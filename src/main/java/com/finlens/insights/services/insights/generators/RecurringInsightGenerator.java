package com.finlens.insights.services.insights.generators;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.RecurringItem;
import com.finlens.insights.dto.insights.InsightDetail.RecurringListDetail;
import com.finlens.insights.dto.insights.InsightTrend;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.InsightUtils;
import com.finlens.insights.services.insights.RecurringCostCalculator;

import lombok.RequiredArgsConstructor;

@Component
@Order(40)
@RequiredArgsConstructor
public class RecurringInsightGenerator implements InsightGenerator {

    private static final int GROWTH_LOOKBACK_MONTHS = 3;
    private static final double GROWTH_MIN_CHANGE_PERCENT = 5.0;
    private static final double GROWTH_WARNING_PERCENT = 10.0;
    private static final double GROWTH_POSITIVE_PERCENT = -10.0;
    // monthly costs within this relative distance look like the same service twice
    private static final double DUPLICATE_COST_TOLERANCE = 0.15;

    private final RecurringCostCalculator recurringCostCalculator;
    private final InsightFormatter formatter;

    @Override
    public List<Insight> generate(InsightContext context) {
        List<Insight> out = new ArrayList<>();
        totalRecurring(context).ifPresent(out::add);
        subscriptionGrowth(context).ifPresent(out::add);
        duplicateSubscriptions(context).ifPresent(out::add);
        return out;
    }

    Optional<Insight> totalRecurring(InsightContext context) {
        List<RecurringSeries> series = recurringCostCalculator.activeExpenseSeries(
                context.getRecurringSeries(), context.getCategories());
        if (series.isEmpty()) {
            return Optional.empty();
        }
        String currency = context.getBaseCurrency();
        List<RecurringItem> items = items(series, currency);
        BigDecimal monthly = InsightUtils.sum(items.stream().map(RecurringItem::monthlyAmount).toList());
        BigDecimal perPeriod = monthly.multiply(context.getGranularity().monthlyMultiplier());

        return Optional.of(Insight.builder()
                .id("total_recurring")
                .type(InsightType.TOTAL_RECURRING_COST)
                .title("Recurring costs")
                .subtitle(series.size() + " active payments per " + context.getGranularity().periodNoun())
                .metric(formatter.money(perPeriod, currency))
                .severity(perPeriod.signum() > 0 ? InsightSeverity.NEUTRAL : InsightSeverity.POSITIVE)
                .category(InsightCategory.RECURRING)
                .detailData(new RecurringListDetail(items))
                .build());
    }

    Optional<Insight> subscriptionGrowth(InsightContext context) {
        List<RecurringSeries> subscriptions = recurringCostCalculator.activeSubscriptions(context.getRecurringSeries());
        if (subscriptions.size() < 2) {
            return Optional.empty();
        }
        LocalDate cutoff = context.getToday().minusMonths(GROWTH_LOOKBACK_MONTHS);
        List<RecurringSeries> older = subscriptions.stream()
                .filter(s -> s.getStartDate() == null || s.getStartDate().isBefore(cutoff))
                .toList();

        String currency = context.getBaseCurrency();
        BigDecimal current = recurringCostCalculator.monthlyTotal(subscriptions, currency);
        BigDecimal previous = recurringCostCalculator.monthlyTotal(older, currency);
        if (previous.signum() <= 0) {
            return Optional.empty();
        }
        double change = InsightUtils.percentChange(current, previous);
        if (Math.abs(change) <= GROWTH_MIN_CHANGE_PERCENT) {
            return Optional.empty();
        }

        InsightSeverity severity;
        if (change > GROWTH_WARNING_PERCENT) {
            severity = InsightSeverity.WARNING;
        } else if (change < GROWTH_POSITIVE_PERCENT) {
            severity = InsightSeverity.POSITIVE;
        } else {
            severity = InsightSeverity.NEUTRAL;
        }

        return Optional.of(Insight.builder()
                .id("subscription_growth")
                .type(InsightType.SUBSCRIPTION_GROWTH)
                .title("Subscription costs")
                .subtitle(formatter.signedPercent(change) + " vs 3 months ago")
                .metric(formatter.money(current, currency))
                .trend(InsightTrend.builder()
                        .direction(InsightUtils.direction(change))
                        .changePercent(change)
                        .changeAbsolute(current.subtract(previous))
                        .comparisonPeriod("vs 3 months ago")
                        .build())
                .severity(severity)
                .category(InsightCategory.RECURRING)
                .build());
    }

    /**
     * Subscriptions sharing a category, or else with nearly equal monthly cost. The metric is what
     * cancelling all but the cheapest one would save per month.
     */
    Optional<Insight> duplicateSubscriptions(InsightContext context) {
        String currency = context.getBaseCurrency();
        List<RecurringItem> subscriptions = items(
                recurringCostCalculator.activeSubscriptions(context.getRecurringSeries()), currency);
        if (subscriptions.size() < 2) {
            return Optional.empty();
        }

        List<RecurringItem> duplicates = sameCategory(subscriptions);
        if (duplicates.isEmpty()) {
            duplicates = similarCost(subscriptions);
        }
        if (duplicates.size() < 2) {
            return Optional.empty();
        }

        List<RecurringItem> sorted = duplicates.stream()
                .sorted(Comparator.comparing(RecurringItem::monthlyAmount))
                .toList();
        BigDecimal savings = InsightUtils.sum(sorted.stream().map(RecurringItem::monthlyAmount).toList())
                .subtract(sorted.get(0).monthlyAmount());

        return Optional.of(Insight.builder()
                .id("duplicate_subscriptions")
                .type(InsightType.DUPLICATE_SUBSCRIPTIONS)
                .title("Possible duplicate subscriptions")
                .subtitle(sorted.size() + " similar subscriptions")
                .metric(formatter.money(savings, currency))
                .severity(InsightSeverity.WARNING)
                .category(InsightCategory.RECURRING)
                .detailData(new RecurringListDetail(sorted))
                .build());
    }

    private static List<RecurringItem> sameCategory(List<RecurringItem> subscriptions) {
        Map<String, List<RecurringItem>> byCategory = new LinkedHashMap<>();
        for (RecurringItem item : subscriptions) {
            byCategory.computeIfAbsent(item.category().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(item);
        }
        return byCategory.values().stream()
                .filter(group -> group.size() >= 2)
                .findFirst()
                .orElse(List.of());
    }

    private static List<RecurringItem> similarCost(List<RecurringItem> subscriptions) {
        List<RecurringItem> sorted = subscriptions.stream()
                .sorted(Comparator.comparing(RecurringItem::monthlyAmount))
                .toList();
        for (int i = 1; i < sorted.size(); i++) {
            BigDecimal lower = sorted.get(i - 1).monthlyAmount();
            BigDecimal higher = sorted.get(i).monthlyAmount();
            if (higher.signum() <= 0) {
                continue;
            }
            double distance = higher.subtract(lower).doubleValue() / higher.doubleValue();
            if (distance <= DUPLICATE_COST_TOLERANCE) {
                return List.of(sorted.get(i - 1), sorted.get(i));
            }
        }
        return List.of();
    }

    private List<RecurringItem> items(List<RecurringSeries> series, String currency) {
        return series.stream()
                .map(s -> new RecurringItem(s.getId(), s.getDescription(),
                        InsightUtils.normalizeCategory(s.getCategory()),
                        recurringCostCalculator.monthlyEquivalent(s, currency)))
                .sorted(Comparator.comparing(RecurringItem::monthlyAmount).reversed())
                .toList();
    }
}
