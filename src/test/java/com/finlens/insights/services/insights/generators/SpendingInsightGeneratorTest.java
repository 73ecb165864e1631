package com.finlens.insights.services.insights.generators;

import static com.finlens.insights.support.InsightsTestData.TODAY;
import static com.finlens.insights.support.InsightsTestData.USD;
import static com.finlens.insights.support.InsightsTestData.expense;
import static com.finlens.insights.support.InsightsTestData.monthBucket;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.finlens.insights.dto.insights.CategoryAggregate;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightDetail.CategoryBreakdownDetail;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.TrendDirection;
import com.finlens.insights.services.aggregates.AggregateReadService;
import com.finlens.insights.services.insights.InsightContext;
import com.finlens.insights.support.InsightsTestData;

@ExtendWith(MockitoExtension.class)
class SpendingInsightGeneratorTest {

    private static final LocalDate APRIL = LocalDate.of(2026, 4, 1);

    @Mock
    private AggregateReadService aggregateReadService;

    private SpendingInsightGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SpendingInsightGenerator(aggregateReadService, InsightsTestData.resolver(), InsightsTestData.formatter());
    }

    @Test
    @DisplayName("Top category is flagged as a warning when it takes more than half of spending")
    void topCategoryWarning() {
        InsightContext context = InsightsTestData.monthContext()
                .windowedTransactions(List.of(
                        expense(LocalDate.of(2026, 4, 2), "300", "Food"),
                        expense(LocalDate.of(2026, 4, 3), "200", "Rent"),
                        expense(LocalDate.of(2026, 3, 3), "900", "Rent")))
                .buckets(List.of(monthBucket(2026, 3, "0", "900"), monthBucket(2026, 4, "0", "500")))
                .build();

        Optional<Insight> insight = generator.topSpendingCategory(context);

        assertThat(insight).isPresent();
        assertThat(insight.get().getId()).isEqualTo("top_spending_Food");
        assertThat(insight.get().getMetric().getValue()).isEqualByComparingTo("300");
        assertThat(insight.get().getSeverity()).isEqualTo(InsightSeverity.WARNING);
        assertThat(((CategoryBreakdownDetail) insight.get().getDetailData()).items())
                .extracting(s -> s.category())
                .containsExactly("Food", "Rent");
    }

    @Test
    @DisplayName("Top category reads category aggregates for a month-aligned current bucket")
    void topCategoryFromAggregates() {
        when(aggregateReadService.fetchCategoryAggregates(APRIL, APRIL.plusMonths(1), USD)).thenReturn(List.of(
                new CategoryAggregate(2026, 4, "Travel", new BigDecimal("100")),
                new CategoryAggregate(2026, 4, "Food", new BigDecimal("120"))));
        InsightContext context = InsightsTestData.monthContext()
                .buckets(List.of(monthBucket(2026, 4, "0", "220")))
                .build();

        Optional<Insight> insight = generator.topSpendingCategory(context);

        assertThat(insight).get().extracting(Insight::getSeverity).isEqualTo(InsightSeverity.WARNING);
        assertThat(insight.get().getSubtitle()).startsWith("Food");
    }

    @Test
    @DisplayName("Spending change above 20% is a warning with an upward trend")
    void periodOverPeriodWarning() {
        InsightContext context = InsightsTestData.monthContext()
                .buckets(List.of(monthBucket(2026, 3, "0", "100"), monthBucket(2026, 4, "0", "125")))
                .build();

        Insight insight = generator.periodOverPeriodChange(context).orElseThrow();

        assertThat(insight.getType()).isEqualTo(InsightType.MONTH_OVER_MONTH_CHANGE);
        assertThat(insight.getTrend().getDirection()).isEqualTo(TrendDirection.UP);
        assertThat(insight.getTrend().getChangePercent()).isEqualTo(25.0);
        assertThat(insight.getTrend().getComparisonPeriod()).isEqualTo("vs last month");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.WARNING);
    }

    @Test
    @DisplayName("A change within two percent reads as flat")
    void periodOverPeriodFlat() {
        InsightContext context = InsightsTestData.monthContext()
                .buckets(List.of(monthBucket(2026, 3, "0", "100"), monthBucket(2026, 4, "0", "101.5")))
                .build();

        Insight insight = generator.periodOverPeriodChange(context).orElseThrow();

        assertThat(insight.getTrend().getDirection()).isEqualTo(TrendDirection.FLAT);
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.NEUTRAL);
    }

    @Test
    @DisplayName("No period comparison for ALL_TIME or without previous spending")
    void periodOverPeriodSkipped() {
        InsightContext allTime = InsightsTestData.monthContext()
                .granularity(InsightGranularity.ALL_TIME)
                .buckets(List.of(monthBucket(2026, 3, "0", "100"), monthBucket(2026, 4, "0", "125")))
                .build();
        InsightContext noPrevious = InsightsTestData.monthContext()
                .buckets(List.of(monthBucket(2026, 3, "0", "0"), monthBucket(2026, 4, "0", "125")))
                .build();

        assertThat(generator.periodOverPeriodChange(allTime)).isEmpty();
        assertThat(generator.periodOverPeriodChange(noPrevious)).isEmpty();
    }

    @Test
    @DisplayName("Average daily spending divides the current bucket by the days elapsed")
    void averageDaily() {
        InsightContext context = InsightsTestData.monthContext()
                .buckets(List.of(monthBucket(2026, 4, "0", "300")))
                .build();

        Insight insight = generator.averageDailySpending(context).orElseThrow();

        assertThat(insight.getMetric().getValue()).isEqualByComparingTo("20");
        assertThat(insight.getMetric().getUnit()).isEqualTo("per day");
    }

    @Test
    @DisplayName("A category more than twice its three-month average is a critical spike")
    void criticalSpike() {
        stubSpike("200", "500");

        Insight insight = generator.spendingSpike(InsightsTestData.monthContext().build()).orElseThrow();

        assertThat(insight.getId()).isEqualTo("spending_spike_Food");
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.CRITICAL);
        assertThat(insight.getTrend().getChangePercent()).isEqualTo(150.0);
    }

    @Test
    @DisplayName("A spike between 1.5x and 2x is a warning")
    void warningSpike() {
        stubSpike("200", "350");

        Insight insight = generator.spendingSpike(InsightsTestData.monthContext().build()).orElseThrow();

        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.WARNING);
    }

    @Test
    @DisplayName("Small categories never count as spikes however large the ratio")
    void spikeNeedsAbsoluteFloor() {
        stubSpike("50", "400");

        assertThat(generator.spendingSpike(InsightsTestData.monthContext().build())).isEmpty();
    }

    @Test
    @DisplayName("Spending under 1.5x the average is not a spike")
    void spikeNeedsRelativeThreshold() {
        stubSpike("200", "290");

        assertThat(generator.spendingSpike(InsightsTestData.monthContext().build())).isEmpty();
    }

    @Test
    @DisplayName("Reports the category with the longest run of monthly increases")
    void categoryTrend() {
        LocalDate from = LocalDate.of(2025, 11, 1);
        when(aggregateReadService.fetchCategoryAggregates(from, TODAY.plusDays(1), USD)).thenReturn(List.of(
                new CategoryAggregate(2025, 11, "Food", new BigDecimal("300")),
                new CategoryAggregate(2025, 12, "Food", new BigDecimal("200")),
                new CategoryAggregate(2026, 1, "Food", new BigDecimal("220")),
                new CategoryAggregate(2026, 2, "Food", new BigDecimal("250")),
                new CategoryAggregate(2026, 3, "Food", new BigDecimal("300")),
                new CategoryAggregate(2026, 1, "Fuel", new BigDecimal("80")),
                new CategoryAggregate(2026, 2, "Fuel", new BigDecimal("90")),
                new CategoryAggregate(2026, 3, "Fuel", new BigDecimal("100"))));

        Insight insight = generator.categoryTrend(InsightsTestData.monthContext().build()).orElseThrow();

        assertThat(insight.getId()).isEqualTo("category_trend_Food");
        assertThat(insight.getSubtitle()).contains("3 months");
        assertThat(insight.getTrend().getChangePercent()).isEqualTo(50.0);
        assertThat(insight.getSeverity()).isEqualTo(InsightSeverity.WARNING);
    }

    private void stubSpike(String historicalMonthly, String current) {
        BigDecimal past = new BigDecimal(historicalMonthly);
        when(aggregateReadService.fetchCategoryAggregates(eq(APRIL.minusMonths(3)), eq(APRIL), eq(USD))).thenReturn(List.of(
                new CategoryAggregate(2026, 1, "Food", past),
                new CategoryAggregate(2026, 2, "Food", past),
                new CategoryAggregate(2026, 3, "Food", past)));
        when(aggregateReadService.fetchCategoryAggregates(eq(APRIL), eq(TODAY.plusDays(1)), eq(USD))).thenReturn(List.of(
                new CategoryAggregate(2026, 4, "Food", new BigDecimal(current))));
    }
}
