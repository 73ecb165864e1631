package com.finlens.insights.dto.insights;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finlens.insights.enums.InsightGranularity;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Totals of one period. {@code periodEnd} is exclusive.
 */
@Value
@Builder
public class PeriodBucket {

    String key;
    InsightGranularity granularity;
    LocalDate periodStart;
    LocalDate periodEnd;
    String label;
    BigDecimal income;
    BigDecimal expenses;
    @With
    BigDecimal cumulativeBalance;

    public BigDecimal getNetFlow() {
        return income.subtract(expenses);
    }
}
