package com.finlens.insights.enums;

public enum CategoryType {
    INCOME, EXPENSE
}
