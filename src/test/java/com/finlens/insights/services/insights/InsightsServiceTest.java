package com.finlens.insights.services.insights;

import static com.finlens.insights.support.InsightsTestData.TODAY;
import static com.finlens.insights.support.InsightsTestData.expense;
import static com.finlens.insights.support.InsightsTestData.income;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.finlens.insights.config.InsightsProperties;
import com.finlens.insights.dto.insights.FinancialHealthScore;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightsResult;
import com.finlens.insights.dto.insights.TimeFilter;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.InsightType;
import com.finlens.insights.enums.TimeFilterPreset;
import com.finlens.insights.repositories.InMemoryTransactionStore;
import com.finlens.insights.services.aggregates.TransactionStoreAggregateReadService;
import com.finlens.insights.services.insights.generators.InsightGenerator;
import com.finlens.insights.support.InsightsTestData;
import com.finlens.insights.support.MutableClock;

@ExtendWith(MockitoExtension.class)
class InsightsServiceTest {

    @Mock
    private HealthScoreService healthScoreService;

    private MutableClock clock;
    private InMemoryTransactionStore store;
    private RecordingGenerator first;
    private RecordingGenerator second;
    private InsightsService service;

    /** Returns one insight per call and remembers every context it saw. */
    private static final class RecordingGenerator implements InsightGenerator {
        private final String id;
        private final List<InsightContext> contexts = new ArrayList<>();
        private boolean failNext;

        private RecordingGenerator(String id) {
            this.id = id;
        }

        @Override
        public List<Insight> generate(InsightContext context) {
            contexts.add(context);
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("generator failed");
            }
            return List.of(Insight.builder().id(id).type(InsightType.NET_CASH_FLOW).build());
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TODAY.atTime(12, 0).toInstant(ZoneOffset.UTC));
        store = spy(new InMemoryTransactionStore(new InMemoryTransactionStore.Snapshot(
                List.of(
                        income(LocalDate.of(2026, 2, 1), "1000", "Salary"),
                        expense(LocalDate.of(2026, 2, 10), "400", "Rent"),
                        income(LocalDate.of(2026, 3, 1), "1000", "Salary"),
                        expense(LocalDate.of(2026, 3, 12), "300", "Food"),
                        expense(LocalDate.of(2026, 4, 5), "150", "Food")),
                List.of(InsightsTestData.account("acc-1", "2500")),
                List.of(),
                List.of())));
        CurrencyAmountResolver resolver = InsightsTestData.resolver();
        PeriodAggregator aggregator = new PeriodAggregator(
                new TransactionStoreAggregateReadService(store, resolver), resolver, InsightsTestData.formatter(),
                InsightsProperties.defaults(), clock);
        first = new RecordingGenerator("first");
        second = new RecordingGenerator("second");
        service = new InsightsService(store, aggregator, List.of(first, second), new ResultCache<>(clock),
                resolver, healthScoreService, clock);
    }

    @Test
    @DisplayName("A cache hit returns the same result without touching the store or generators")
    void cacheHit() {
        InsightsResult computed = service.generateAllInsights(InsightGranularity.MONTH, "USD");
        InsightsResult cached = service.generateAllInsights(InsightGranularity.MONTH, "USD");

        assertThat(cached).isSameAs(computed);
        assertThat(first.contexts).hasSize(1);
        verify(store, times(1)).listTransactions();
    }

    @Test
    @DisplayName("Currency codes are normalized before keying and reaching generators")
    void normalizesCurrency() {
        InsightsResult computed = service.generateAllInsights(InsightGranularity.MONTH, " usd ");

        assertThat(service.generateAllInsights(InsightGranularity.MONTH, "USD")).isSameAs(computed);
        assertThat(first.contexts.get(0).getBaseCurrency()).isEqualTo("USD");
    }

    @Test
    @DisplayName("Entries are recomputed once the TTL has passed")
    void recomputesAfterTtl() {
        service.generateAllInsights(InsightGranularity.MONTH, "USD");
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        service.generateAllInsights(InsightGranularity.MONTH, "USD");

        assertThat(first.contexts).hasSize(2);
    }

    @Test
    @DisplayName("Invalidation forces the next call to recompute")
    void invalidateForcesRecompute() {
        InsightsResult computed = service.generateAllInsights(InsightGranularity.MONTH, "USD");
        service.invalidateCache();

        InsightsResult recomputed = service.generateAllInsights(InsightGranularity.MONTH, "USD");

        assertThat(recomputed).isNotSameAs(computed);
        assertThat(first.contexts).hasSize(2);
    }

    @Test
    @DisplayName("Invalidating a currency drops only the entries keyed by it")
    void invalidateCurrency() {
        service.generateAllInsights(InsightGranularity.MONTH, "USD");
        service.generateAllInsights(InsightGranularity.MONTH, "EUR");
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "EUR");

        assertThat(service.invalidateCurrency("eur")).isEqualTo(2);

        service.generateAllInsights(InsightGranularity.MONTH, "USD");
        assertThat(first.contexts).hasSize(3);
    }

    @Test
    @DisplayName("Generators run in order and share one bucket list")
    void generatorOrderAndSharedBuckets() {
        InsightsResult result = service.generateAllInsights(InsightGranularity.MONTH, "USD");

        assertThat(result.insights()).extracting(Insight::getId).containsExactly("first", "second");
        assertThat(second.contexts.get(0).getBuckets()).isSameAs(first.contexts.get(0).getBuckets());
        assertThat(result.buckets()).extracting(b -> b.getKey()).endsWith("2026-02", "2026-03", "2026-04");
        assertThat(result.summary().totalIncome()).isEqualByComparingTo("2000");
    }

    @Test
    @DisplayName("A failing generator propagates and leaves nothing cached")
    void generatorFailureIsNotCached() {
        second.failNext = true;

        assertThatThrownBy(() -> service.generateAllInsights(InsightGranularity.MONTH, "USD"))
                .isInstanceOf(IllegalStateException.class);

        InsightsResult result = service.generateAllInsights(InsightGranularity.MONTH, "USD");
        assertThat(result.insights()).hasSize(2);
        assertThat(first.contexts).hasSize(2);
    }

    @Test
    @DisplayName("Different time filters are cached under different keys")
    void timeFiltersCachedSeparately() {
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "USD");
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.LAST_MONTH), "USD");
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "USD");

        assertThat(first.contexts).hasSize(2);
    }

    @Test
    @DisplayName("A cached time filter is served without reading the store")
    void timeFilterCacheHitSkipsStore() {
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "USD");
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_MONTH), "USD");

        assertThat(first.contexts).hasSize(1);
        verify(store, times(1)).listTransactions();
        verify(store, times(1)).listAccounts();
    }

    @Test
    @DisplayName("A time filter with no transactions still gets its zero bucket")
    void emptyFilterWindowHasBucket() {
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.THIS_WEEK), "USD");

        InsightContext context = first.contexts.get(0);
        assertThat(context.getWindowedTransactions()).isEmpty();
        assertThat(context.getBuckets()).hasSize(1);
        assertThat(context.getBuckets().get(0).getKey()).isEqualTo("2026-04");
        assertThat(context.getBuckets().get(0).getExpenses()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A past time filter is read as of its last day")
    void pastFilterUsesWindowEnd() {
        service.generateAllInsights(TimeFilter.of(TimeFilterPreset.LAST_MONTH), "USD");

        InsightContext context = first.contexts.get(0);
        assertThat(context.getReferenceDate()).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(context.getWindowedTransactions()).hasSize(2);
        assertThat(context.getGranularity()).isEqualTo(InsightGranularity.MONTH);
    }

    @Test
    @DisplayName("All granularities are computed once each")
    void computeAllGranularities() {
        Map<InsightGranularity, InsightsResult> results = service.computeAllGranularities("USD");

        assertThat(results).containsOnlyKeys(InsightGranularity.values());
        assertThat(results.get(InsightGranularity.ALL_TIME).buckets()).hasSize(1);
        assertThat(first.contexts).extracting(InsightContext::getGranularity)
                .containsExactly(InsightGranularity.values());
    }

    @Test
    @DisplayName("Health score is computed from the same summary the insights were built on")
    void healthScore() {
        FinancialHealthScore expected = FinancialHealthScore.builder().score(72).grade("Good").build();
        when(healthScoreService.compute(any())).thenReturn(expected);

        FinancialHealthScore score = service.computeHealthScore(InsightGranularity.MONTH, "USD");

        assertThat(score).isSameAs(expected);
        ArgumentCaptor<InsightContext> captor = ArgumentCaptor.forClass(InsightContext.class);
        verify(healthScoreService).compute(captor.capture());
        assertThat(captor.getValue().getSummary().totalExpenses()).isEqualByComparingTo("850");
        assertThat(captor.getValue().totalBalance()).isEqualByComparingTo("2500");
    }
}
