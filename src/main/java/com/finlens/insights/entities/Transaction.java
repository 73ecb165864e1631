package com.finlens.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finlens.insights.enums.TransactionType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Transaction {

    String id;
    LocalDate date;
    BigDecimal amount;
    String currency;
    // amount already expressed in the base currency, when the store has it
    BigDecimal convertedAmount;
    TransactionType type;
    String category;
    String subcategory;
    String description;
    String accountId;

    public boolean isIncome() {
        return type == TransactionType.INCOME;
    }

    public boolean isExpense() {
        return type == TransactionType.EXPENSE;
    }
}
