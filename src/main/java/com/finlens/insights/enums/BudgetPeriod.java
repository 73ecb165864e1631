package com.finlens.insights.enums;

public enum BudgetPeriod {
    WEEKLY, MONTHLY, YEARLY
}
