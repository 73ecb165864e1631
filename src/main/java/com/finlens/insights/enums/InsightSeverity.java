package com.finlens.insights.enums;

public enum InsightSeverity {
    POSITIVE, NEUTRAL, WARNING, CRITICAL
}
