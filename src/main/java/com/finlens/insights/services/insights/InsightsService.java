package com.finlens.insights.services.insights;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.finlens.insights.dto.insights.DateWindow;
import com.finlens.insights.dto.insights.FinancialHealthScore;
import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.dto.insights.InsightsResult;
import com.finlens.insights.dto.insights.PeriodBucket;
import com.finlens.insights.dto.insights.PeriodSummary;
import com.finlens.insights.dto.insights.TimeFilter;
import com.finlens.insights.entities.Account;
import com.finlens.insights.entities.Category;
import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.enums.InsightGranularity;
import com.finlens.insights.enums.TimeFilterPreset;
import com.finlens.insights.repositories.TransactionStore;
import com.finlens.insights.services.insights.generators.InsightGenerator;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine. Serves cached results, otherwise runs window, period summary, buckets and
 * every generator once, and caches the complete result.
 */
@Slf4j
@Service
public class InsightsService {

    private final TransactionStore transactionStore;
    private final PeriodAggregator periodAggregator;
    private final List<InsightGenerator> generators;
    private final ResultCache<InsightsResult> resultCache;
    private final CurrencyAmountResolver currencyAmountResolver;
    private final HealthScoreService healthScoreService;
    private final Clock clock;

    public InsightsService(
            TransactionStore transactionStore,
            PeriodAggregator periodAggregator,
            List<InsightGenerator> generators,
            ResultCache<InsightsResult> resultCache,
            CurrencyAmountResolver currencyAmountResolver,
            HealthScoreService healthScoreService,
            Clock clock
    ) {
        this.transactionStore = transactionStore;
        this.periodAggregator = periodAggregator;
        this.generators = List.copyOf(generators);
        this.resultCache = resultCache;
        this.currencyAmountResolver = currencyAmountResolver;
        this.healthScoreService = healthScoreService;
        this.clock = clock;
    }

    private record StoreSnapshot(
            List<Transaction> transactions,
            List<Account> accounts,
            List<Category> categories,
            List<RecurringSeries> recurringSeries
    ) {
    }

    public List<Insight> generateAllInsights(TimeFilter timeFilter, String baseCurrency) {
        Objects.requireNonNull(timeFilter, "timeFilter");
        String currency = InsightsCacheKeys.normalizeCurrency(baseCurrency);
        LocalDate today = LocalDate.now(clock);
        // only ALL_TIME depends on the data; every other preset is keyed without reading the store
        StoreSnapshot snapshot = timeFilter.preset() == TimeFilterPreset.ALL_TIME ? snapshot() : null;
        LocalDate first = snapshot != null ? PeriodAggregator.earliestDate(snapshot.transactions()) : null;
        DateWindow window = timeFilter.resolve(today, first);
        String key = InsightsCacheKeys.forTimeFilter(timeFilter.preset(), currency, window, clock.getZone());

        Optional<InsightsResult> cached = resultCache.get(key);
        if (cached.isPresent()) {
            log.debug("[Insights] Cache HIT key={}", key);
            return cached.get().insights();
        }

        // a past window is read as of its own last day
        LocalDate reference = !window.isEmpty() && window.lastDay().isBefore(today) ? window.lastDay() : today;
        InsightsResult result = compute(snapshot != null ? snapshot : snapshot(), InsightGranularity.MONTH,
                window, reference, currency);
        resultCache.put(key, result);
        log.info("[Insights] Computed key={} insights={}", key, result.insights().size());
        return result.insights();
    }

    public InsightsResult generateAllInsights(InsightGranularity granularity, String baseCurrency) {
        return generateAllInsights(granularity, baseCurrency, null);
    }

    /**
     * @param firstTransactionDate earliest transaction date when the caller already knows it, otherwise {@code null}
     */
    public InsightsResult generateAllInsights(InsightGranularity granularity, String baseCurrency,
                                              LocalDate firstTransactionDate) {
        Objects.requireNonNull(granularity, "granularity");
        String currency = InsightsCacheKeys.normalizeCurrency(baseCurrency);
        String key = InsightsCacheKeys.forGranularity(granularity, currency);

        Optional<InsightsResult> cached = resultCache.get(key);
        if (cached.isPresent()) {
            log.debug("[Insights] Cache HIT key={}", key);
            return cached.get();
        }

        StoreSnapshot snapshot = snapshot();
        LocalDate first = firstTransactionDate != null
                ? firstTransactionDate
                : PeriodAggregator.earliestDate(snapshot.transactions());
        DateWindow window = periodAggregator.defaultWindow(granularity, first);
        InsightsResult result = compute(snapshot, granularity, window, LocalDate.now(clock), currency);
        resultCache.put(key, result);
        log.info("[Insights] Computed key={} insights={} buckets={}", key, result.insights().size(), result.buckets().size());
        return result;
    }

    public Map<InsightGranularity, InsightsResult> computeAllGranularities(String baseCurrency) {
        LocalDate first = PeriodAggregator.earliestDate(transactionStore.listTransactions());
        Map<InsightGranularity, InsightsResult> out = new EnumMap<>(InsightGranularity.class);
        for (InsightGranularity granularity : InsightGranularity.values()) {
            out.put(granularity, generateAllInsights(granularity, baseCurrency, first));
        }
        return out;
    }

    public FinancialHealthScore computeHealthScore(InsightGranularity granularity, String baseCurrency) {
        InsightsResult result = generateAllInsights(granularity, baseCurrency);
        String currency = InsightsCacheKeys.normalizeCurrency(baseCurrency);
        StoreSnapshot snapshot = snapshot();
        DateWindow window = periodAggregator.defaultWindow(granularity,
                PeriodAggregator.earliestDate(snapshot.transactions()));
        InsightContext context = context(snapshot, windowed(snapshot, window), granularity, window,
                LocalDate.now(clock), currency, result.summary(), result.buckets());
        return healthScoreService.compute(context);
    }

    public void invalidateCache() {
        resultCache.invalidateAll();
        log.info("[Insights] Cache invalidated");
    }

    public int invalidateCache(Predicate<String> keyPredicate) {
        int removed = resultCache.invalidate(keyPredicate);
        log.info("[Insights] Cache invalidated entries={}", removed);
        return removed;
    }

    public int invalidateCurrency(String currency) {
        String marker = "_" + InsightsCacheKeys.normalizeCurrency(currency);
        return invalidateCache(key -> key.endsWith(marker) || key.contains(marker + "_"));
    }

    private InsightsResult compute(StoreSnapshot snapshot, InsightGranularity granularity, DateWindow window,
                                   LocalDate reference, String currency) {
        List<Transaction> windowed = windowed(snapshot, window);
        PeriodSummary summary = periodAggregator.summarize(windowed, currency);
        List<PeriodBucket> buckets = periodAggregator.computeBuckets(windowed, granularity, window, currency);

        InsightContext context = context(snapshot, windowed, granularity, window, reference, currency, summary, buckets);
        List<Insight> insights = new ArrayList<>();
        for (InsightGenerator generator : generators) {
            insights.addAll(generator.generate(context));
        }
        return new InsightsResult(insights, buckets, summary);
    }

    private InsightContext context(StoreSnapshot snapshot, List<Transaction> windowed, InsightGranularity granularity,
                                   DateWindow window, LocalDate reference, String currency, PeriodSummary summary,
                                   List<PeriodBucket> buckets) {
        Map<String, Account> accountsById = snapshot.accounts().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toMap(Account::getId, Function.identity(), (a, b) -> a));

        return InsightContext.builder()
                .windowedTransactions(windowed)
                .allTransactions(snapshot.transactions())
                .summary(summary)
                .buckets(buckets)
                .granularity(granularity)
                .window(window)
                .referenceDate(reference)
                .today(LocalDate.now(clock))
                .baseCurrency(currency)
                .balanceLookup(accountId -> {
                    Account account = accountsById.get(accountId);
                    return account == null ? null
                            : currencyAmountResolver.toBase(account.getBalance(), account.getCurrency(), currency);
                })
                .accounts(snapshot.accounts())
                .categories(snapshot.categories())
                .recurringSeries(snapshot.recurringSeries())
                .build();
    }

    private static List<Transaction> windowed(StoreSnapshot snapshot, DateWindow window) {
        return snapshot.transactions().stream()
                .filter(Objects::nonNull)
                .filter(tx -> window.contains(tx.getDate()))
                .toList();
    }

    private StoreSnapshot snapshot() {
        return new StoreSnapshot(
                List.copyOf(transactionStore.listTransactions()),
                List.copyOf(transactionStore.listAccounts()),
                List.copyOf(transactionStore.listCategories()),
                List.copyOf(transactionStore.listRecurringSeries())
        );
    }
}
