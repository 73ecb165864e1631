package com.finlens.insights.enums;

public enum TransactionType {
    INCOME, EXPENSE, TRANSFER
}
