package com.finlens.insights.services.insights;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finlens.insights.support.MutableClock;

class ResultCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-04-15T12:00:00Z"));
    }

    @Test
    @DisplayName("Returns empty for a key that was never stored")
    void missingKey() {
        ResultCache<String> cache = new ResultCache<>(clock);

        assertThat(cache.get("nope")).isEmpty();
    }

    @Test
    @DisplayName("Evicts the least recently used key when full, and a read counts as use")
    void evictsLeastRecentlyUsed() {
        ResultCache<String> cache = new ResultCache<>(2, Duration.ofMinutes(5), clock);

        cache.put("A", "a");
        cache.put("B", "b");
        assertThat(cache.get("A")).contains("a");
        cache.put("C", "c");

        assertThat(cache.get("B")).isEmpty();
        assertThat(cache.get("A")).contains("a");
        assertThat(cache.get("C")).contains("c");
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Never holds more entries than its capacity")
    void neverExceedsCapacity() {
        ResultCache<Integer> cache = new ResultCache<>(20, Duration.ofMinutes(5), clock);

        for (int i = 0; i < 100; i++) {
            cache.put("key-" + i, i);
            assertThat(cache.size()).isLessThanOrEqualTo(20);
        }
        assertThat(cache.size()).isEqualTo(20);
        assertThat(cache.get("key-79")).isEmpty();
        assertThat(cache.get("key-80")).contains(80);
    }

    @Test
    @DisplayName("Expires an entry once it is older than the TTL and removes it")
    void expiresAfterTtl() {
        ResultCache<String> cache = new ResultCache<>(5, Duration.ofSeconds(300), clock);
        cache.put("k", "v");

        clock.advance(Duration.ofSeconds(300));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Overwriting a key refreshes its timestamp and makes it most recently used")
    void overwriteRefreshesEntry() {
        ResultCache<String> cache = new ResultCache<>(2, Duration.ofSeconds(300), clock);
        cache.put("A", "a1");
        cache.put("B", "b");

        clock.advance(Duration.ofSeconds(200));
        cache.put("A", "a2");
        cache.put("C", "c");

        assertThat(cache.get("B")).isEmpty();
        clock.advance(Duration.ofSeconds(200));
        assertThat(cache.get("A")).contains("a2");
    }

    @Test
    @DisplayName("Clamps a non-positive capacity to one")
    void clampsCapacity() {
        ResultCache<String> cache = new ResultCache<>(0, Duration.ofMinutes(5), clock);

        cache.put("A", "a");
        cache.put("B", "b");

        assertThat(cache.capacity()).isEqualTo(1);
        assertThat(cache.get("A")).isEmpty();
        assertThat(cache.get("B")).contains("b");
    }

    @Test
    @DisplayName("Invalidates everything or only the keys matching a predicate")
    void invalidation() {
        ResultCache<String> cache = new ResultCache<>(clock);
        cache.put("granularity_MONTH_USD", "1");
        cache.put("granularity_YEAR_USD", "2");
        cache.put("granularity_MONTH_EUR", "3");

        int removed = cache.invalidate(key -> key.endsWith("_USD"));

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("granularity_MONTH_EUR")).contains("3");

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Stays within capacity under concurrent writers and readers")
    void concurrentAccess() throws Exception {
        ResultCache<Integer> cache = new ResultCache<>(10, Duration.ofMinutes(5), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        String key = "k-" + ((thread * 31 + i) % 40);
                        cache.put(key, i);
                        cache.get(key);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.size()).isLessThanOrEqualTo(10);
    }
}
