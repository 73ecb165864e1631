package com.finlens.insights.enums;

public enum TimeFilterPreset {
    TODAY,
    YESTERDAY,
    THIS_WEEK,
    LAST_30_DAYS,
    THIS_MONTH,
    LAST_MONTH,
    THIS_YEAR,
    LAST_YEAR,
    ALL_TIME,
    CUSTOM
}
