package com.finlens.insights.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        Duration cacheTtl,
        Integer cacheCapacity,
        Integer weekLookback,
        Locale locale,
        String defaultCurrency,
        Map<String, BigDecimal> exchangeRates
) {
    public InsightsProperties {
        if (cacheTtl == null) {
            cacheTtl = Duration.ofMinutes(5);
        }
        if (cacheCapacity == null) {
            cacheCapacity = 20;
        }
        if (weekLookback == null || weekLookback < 1) {
            weekLookback = 52;
        }
        if (locale == null) {
            locale = Locale.US;
        }
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "USD";
        }
        if (exchangeRates == null) {
            exchangeRates = Map.of();
        }
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null, null, null, null);
    }
}
