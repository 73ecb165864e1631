package com.finlens.insights.services.insights.generators;

import java.util.List;

import com.finlens.insights.dto.insights.Insight;
import com.finlens.insights.services.insights.InsightContext;

/**
 * One insight domain. Implementations are stateless, run in {@code @Order} sequence and
 * return an empty list when there is nothing to report.
 */
public interface InsightGenerator {
    List<Insight> generate(InsightContext context);
}
