package com.finlens.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.finlens.insights.enums.RecurringFrequency;
import com.finlens.insights.enums.RecurringSeriesKind;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RecurringSeries {

    String id;
    String description;
    BigDecimal amount;
    String currency;
    String category;
    RecurringFrequency frequency;
    @Builder.Default
    RecurringSeriesKind kind = RecurringSeriesKind.GENERIC;
    LocalDate startDate;
    @Builder.Default
    boolean active = true;

    public boolean isSubscription() {
        return kind == RecurringSeriesKind.SUBSCRIPTION;
    }
}
