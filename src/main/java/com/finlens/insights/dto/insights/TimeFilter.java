package com.finlens.insights.dto.insights;

import java.time.LocalDate;

import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.TimeFilterPreset;

/**
 * A user-selected date range. {@code start}/{@code end} are only read for {@link TimeFilterPreset#CUSTOM}.
 */
public record TimeFilter(TimeFilterPreset preset, LocalDate start, LocalDate end) {

    public static TimeFilter of(TimeFilterPreset preset) {
        return new TimeFilter(preset, null, null);
    }

    public static TimeFilter custom(LocalDate start, LocalDate end) {
        return new TimeFilter(TimeFilterPreset.CUSTOM, start, end);
    }

    /**
     * Resolves the filter into a half-open window relative to {@code today}.
     *
     * @param firstTransactionDate used by {@link TimeFilterPreset#ALL_TIME}, may be {@code null}
     */
    public DateWindow resolve(LocalDate today, LocalDate firstTransactionDate) {
        LocalDate tomorrow = today.plusDays(1);
        return switch (preset) {
            case TODAY -> new DateWindow(today, tomorrow);
            case YESTERDAY -> new DateWindow(today.minusDays(1), today);
            case THIS_WEEK -> new DateWindow(InsightGranularity.WEEK.periodStart(today), tomorrow);
            case LAST_30_DAYS -> new DateWindow(today.minusDays(29), tomorrow);
            case THIS_MONTH -> new DateWindow(today.withDayOfMonth(1), tomorrow);
            case LAST_MONTH -> new DateWindow(today.withDayOfMonth(1).minusMonths(1), today.withDayOfMonth(1));
            case THIS_YEAR -> new DateWindow(today.withDayOfYear(1), tomorrow);
            case LAST_YEAR -> new DateWindow(today.withDayOfYear(1).minusYears(1), today.withDayOfYear(1));
            case ALL_TIME -> new DateWindow(firstTransactionDate != null ? firstTransactionDate : today, tomorrow);
            case CUSTOM -> new DateWindow(start, end);
        };
    }
}
