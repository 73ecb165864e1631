package com.finlens.insights.enums;

public enum InsightCategory {
    SPENDING, INCOME, BUDGET, RECURRING, CASH_FLOW, WEALTH, SAVINGS, FORECASTING
}
