package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.enums.CategoryType;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.TrendDirection;

public final class InsightUtils {

    public static final String UNCATEGORIZED = "Other";

    // changes within +/- this many percent read as flat
    private static final double FLAT_BAND_PERCENT = 2.0;

    private InsightUtils() {
    }

    public static String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            return UNCATEGORIZED;
        }
        return category.trim();
    }

    public static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal sum(List<BigDecimal> values) {
        if (values == null) {
            return BigDecimal.ZERO;
        }
        return values.stream().filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static double mean(List<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        int n = 0;
        for (BigDecimal v : values) {
            if (v == null) {
                continue;
            }
            sum += v.doubleValue();
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    /** (current - previous) / |previous| * 100; 0 when previous is zero. */
    public static double percentChange(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) {
            return 0.0;
        }
        double prev = previous.doubleValue();
        return (nullToZero(current).doubleValue() - prev) / Math.abs(prev) * 100.0;
    }

    public static TrendDirection direction(double changePercent) {
        if (changePercent > FLAT_BAND_PERCENT) {
            return TrendDirection.UP;
        }
        if (changePercent < -FLAT_BAND_PERCENT) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.FLAT;
    }

    public static TrendDirection directionOfSign(BigDecimal value) {
        int signum = nullToZero(value).signum();
        return signum > 0 ? TrendDirection.UP : signum < 0 ? TrendDirection.DOWN : TrendDirection.FLAT;
    }

    /** POSITIVE above zero, CRITICAL below, NEUTRAL otherwise. */
    public static InsightSeverity severityOfSign(BigDecimal value) {
        int signum = nullToZero(value).signum();
        return signum > 0 ? InsightSeverity.POSITIVE : signum < 0 ? InsightSeverity.CRITICAL : InsightSeverity.NEUTRAL;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** The last {@code months} calendar months, the current (partial) one included. */
    public static DateWindow lastMonths(LocalDate today, int months) {
        LocalDate start = today.withDayOfMonth(1).minusMonths(Math.max(1, months) - 1L);
        return new DateWindow(start, today.plusDays(1));
    }

    /** The {@code months} complete calendar months before the current one. */
    public static DateWindow completedMonthsBefore(LocalDate today, int months) {
        LocalDate currentMonth = today.withDayOfMonth(1);
        return new DateWindow(currentMonth.minusMonths(months), currentMonth);
    }

    /** A series counts as income when its category is an income category. */
    public static boolean isIncomeSeries(RecurringSeries series, List<Category> categories) {
        if (series == null || categories == null) {
            return false;
        }
        String name = normalizeCategory(series.getCategory());
        return categories.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.getType() == CategoryType.INCOME)
                .anyMatch(c -> name.equalsIgnoreCase(normalizeCategory(c.getName())));
    }
}
