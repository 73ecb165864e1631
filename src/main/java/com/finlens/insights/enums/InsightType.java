package com.finlens.insights.enums;

public enum InsightType {
    // spending
    TOP_SPENDING_CATEGORY,
    MONTH_OVER_MONTH_CHANGE,
    AVERAGE_DAILY_SPENDING,
    SPENDING_SPIKE,
    CATEGORY_TREND,
    // income
    INCOME_GROWTH,
    INCOME_VS_EXPENSE_RATIO,
    INCOME_SOURCE_BREAKDOWN,
    // budget
    BUDGET_OVERSPEND,
    PROJECTED_OVERSPEND,
    BUDGET_UNDERUTILIZED,
    // recurring
    TOTAL_RECURRING_COST,
    SUBSCRIPTION_GROWTH,
    DUPLICATE_SUBSCRIPTIONS,
    // cash flow
    NET_CASH_FLOW,
    BEST_PERIOD,
    WORST_PERIOD,
    PROJECTED_BALANCE,
    // wealth
    TOTAL_WEALTH,
    WEALTH_GROWTH,
    ACCOUNT_DORMANCY,
    // savings
    SAVINGS_RATE,
    EMERGENCY_FUND,
    SAVINGS_MOMENTUM,
    // forecasting
    SPENDING_FORECAST,
    BALANCE_RUNWAY,
    YEAR_OVER_YEAR,
    SPENDING_VELOCITY,
    INCOME_SEASONALITY
}
