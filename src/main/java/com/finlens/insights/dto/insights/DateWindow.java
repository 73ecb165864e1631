package com.finlens.insights.dto.insights;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Half-open date range {@code [start, end)}.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && date.isBefore(end);
    }

    public LocalDate lastDay() {
        return end.minusDays(1);
    }
}
