package com.finlens.insights.entities;

import java.math.BigDecimal;

import com.finlens.insights.enums.BudgetPeriod;
import com.finlens.insights.enums.CategoryType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Category {

    String id;
    String name;
    CategoryType type;
    BigDecimal budgetAmount;
    @Builder.Default
    BudgetPeriod budgetPeriod = BudgetPeriod.MONTHLY;
    @Builder.Default
    int budgetResetDay = 1;

    public boolean hasBudget() {
        return budgetAmount != null && budgetAmount.signum() > 0;
    }
}
