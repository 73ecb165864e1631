package com.finlens.insights.dto.insights;

import java.util.List;

/**
 * Everything one orchestrator pass produces. This is the cached unit.
 */
public record InsightsResult(List<Insight> insights, List<PeriodBucket> buckets, PeriodSummary summary) {

    public InsightsResult {
        insights = List.copyOf(insights);
        buckets = List.copyOf(buckets);
    }
}
