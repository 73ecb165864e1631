package com.finlens.insights.dto.insights;

import java.math.BigDecimal;

import com.finlens.insights.enums.TrendDirection;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsightTrend {

    TrendDirection direction;
    Double changePercent;
    BigDecimal changeAbsolute;
    String comparisonPeriod;
}
