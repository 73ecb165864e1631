package com.finlens.insights.enums;

public enum RecurringSeriesKind {
    GENERIC, SUBSCRIPTION
}
