package com.finlens.insights.dto.insights;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsightMetric {

    BigDecimal value;
    String formattedValue;
    String currency;
    String unit;
}
