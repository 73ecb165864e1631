package com.finlens.insights.dto.insights;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CategoryAggregate(int year, int month, String categoryName, BigDecimal totalExpenses) {

    public LocalDate monthStart() {
        return LocalDate.of(year, month, 1);
    }
}
