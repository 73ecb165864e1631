package com.finlens.insights.dto.insights;

import com.finlens.insights.enums.InsightCategory;
import com.finlens.insights.enums.InsightSeverity;
import com.finlens.insights.enums.InsightType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Insight {

    String id;
    InsightType type;
    String title;
    String subtitle;
    InsightMetric metric;
    InsightTrend trend;
    InsightSeverity severity;
    InsightCategory category;
    InsightDetail detailData;
}
