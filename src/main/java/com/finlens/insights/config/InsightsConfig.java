package com.finlens.insights.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.finlens.insights.dto.insights.InsightsResult;
import com.finlens.insights.services.insights.InsightFormatter;
import com.finlens.insights.services.insights.ResultCache;

@Configuration
public class InsightsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ResultCache<InsightsResult> insightsResultCache(InsightsProperties properties, Clock clock) {
        return new ResultCache<>(properties.cacheCapacity(), properties.cacheTtl(), clock);
    }

    @Bean
    public InsightFormatter insightFormatter(InsightsProperties properties) {
        return new InsightFormatter(properties.locale());
    }
}
