package com.finlens.insights.services.aggregates;

import java.time.LocalDate;
import java.util.List;

import com.finlens.insights.dto.insights.CategoryAggregate;
import com.finlens.insights.dto.insights.MonthlyAggregate;

/**
 * Precomputed per-month totals. An empty result means the aggregates are not ready and
 * callers fall back to scanning transactions.
 */
public interface AggregateReadService {

    /** Monthly records whose month overlaps {@code [from, to)}, chronological. */
    List<MonthlyAggregate> fetchMonthlyAggregates(LocalDate from, LocalDate to, String currency);

    /** Per-category expense records whose month overlaps {@code [from, to)}, chronological. */
    List<CategoryAggregate> fetchCategoryAggregates(LocalDate from, LocalDate to, String currency);
}
