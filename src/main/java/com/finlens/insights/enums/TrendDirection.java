package com.finlens.insights.enums;

public enum TrendDirection {
    UP, DOWN, FLAT
}
