package com.finlens.insights.enums;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

import com.finlens.insights.dto.insights.DateWindow;

/**
 * Time-bucketing modes. Each constant owns its default window, step, bucket key and label.
 */
public enum InsightGranularity {
    WEEK("week", "vs last week"),
    MONTH("month", "vs last month"),
    QUARTER("quarter", "vs last quarter"),
    YEAR("year", "vs last year"),
    ALL_TIME("period", "");

    public static final String ALL_TIME_KEY = "all";

    private final String periodNoun;
    private final String comparisonPeriodName;

    InsightGranularity(String periodNoun, String comparisonPeriodName) {
        this.periodNoun = periodNoun;
        this.comparisonPeriodName = comparisonPeriodName;
    }

    public String periodNoun() {
        return periodNoun;
    }

    public String comparisonPeriodName() {
        return comparisonPeriodName;
    }

    /**
     * Window the aggregator covers when the caller gives none. The end is always the start of tomorrow.
     *
     * @param firstTransactionDate earliest known transaction, may be {@code null}
     * @param weekLookback number of ISO weeks (current one included) for {@link #WEEK}
     */
    public DateWindow defaultWindow(LocalDate firstTransactionDate, LocalDate today, int weekLookback) {
        LocalDate end = today.plusDays(1);
        LocalDate start = switch (this) {
            case WEEK -> periodStart(today).minusWeeks(Math.max(1, weekLookback) - 1L);
            case MONTH -> periodStart(firstTransactionDate != null ? firstTransactionDate : today.minusMonths(12));
            case QUARTER -> periodStart(firstTransactionDate != null ? firstTransactionDate : today.minusMonths(12));
            case YEAR -> periodStart(firstTransactionDate != null ? firstTransactionDate : today.minusYears(3));
            case ALL_TIME -> firstTransactionDate != null ? firstTransactionDate : today;
        };
        return new DateWindow(start, end);
    }

    /** Aligned start of the period containing {@code date}. */
    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
            case QUARTER -> LocalDate.of(date.getYear(), ((date.getMonthValue() - 1) / 3) * 3 + 1, 1);
            case YEAR -> date.withDayOfYear(1);
            case ALL_TIME -> date;
        };
    }

    /** Start of the following period. Not defined for {@link #ALL_TIME}, which has a single period. */
    public LocalDate next(LocalDate periodStart) {
        return switch (this) {
            case WEEK -> periodStart.plusWeeks(1);
            case MONTH -> periodStart.plusMonths(1);
            case QUARTER -> periodStart.plusMonths(3);
            case YEAR -> periodStart.plusYears(1);
            case ALL_TIME -> throw new UnsupportedOperationException("ALL_TIME has a single period");
        };
    }

    public LocalDate previous(LocalDate date) {
        return switch (this) {
            case WEEK -> date.minusWeeks(1);
            case MONTH -> date.minusMonths(1);
            case QUARTER -> date.minusMonths(3);
            case YEAR -> date.minusYears(1);
            case ALL_TIME -> date;
        };
    }

    public String key(LocalDate date) {
        return switch (this) {
            case WEEK -> String.format("%04d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH -> String.format("%04d-%02d", date.getYear(), date.getMonthValue());
            case QUARTER -> String.format("%04d-Q%d", date.getYear(), (date.getMonthValue() - 1) / 3 + 1);
            case YEAR -> String.format("%04d", date.getYear());
            case ALL_TIME -> ALL_TIME_KEY;
        };
    }

    public String currentKey(LocalDate reference) {
        return key(reference);
    }

    public String previousKey(LocalDate reference) {
        return key(previous(reference));
    }

    public String label(LocalDate periodStart, LocalDate today, Locale locale) {
        return switch (this) {
            case WEEK -> {
                boolean sameYear = periodStart.get(IsoFields.WEEK_BASED_YEAR) == today.get(IsoFields.WEEK_BASED_YEAR);
                String pattern = sameYear ? "d MMM" : "d MMM''yy";
                yield periodStart.format(DateTimeFormatter.ofPattern(pattern, locale));
            }
            case MONTH -> periodStart.format(DateTimeFormatter.ofPattern("MMM yyyy", locale));
            case QUARTER -> "Q" + ((periodStart.getMonthValue() - 1) / 3 + 1) + " " + periodStart.getYear();
            case YEAR -> String.valueOf(periodStart.getYear());
            case ALL_TIME -> "All time";
        };
    }

    /** Factor turning a monthly amount into an amount for one period of this granularity. */
    public BigDecimal monthlyMultiplier() {
        return switch (this) {
            case WEEK -> BigDecimal.valueOf(7).divide(BigDecimal.valueOf(30), MathContext.DECIMAL64);
            case MONTH, ALL_TIME -> BigDecimal.ONE;
            case QUARTER -> BigDecimal.valueOf(3);
            case YEAR -> BigDecimal.valueOf(12);
        };
    }

    /** Only these granularities can be folded from monthly aggregates. */
    public boolean supportsMonthlyAggregates() {
        return this == YEAR || this == ALL_TIME;
    }
}
