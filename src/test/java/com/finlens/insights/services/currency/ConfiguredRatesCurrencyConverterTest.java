package com.finlens.insights.services.currency;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfiguredRatesCurrencyConverterTest {

    private final ConfiguredRatesCurrencyConverter converter = new ConfiguredRatesCurrencyConverter(Map.of(
            "USD", BigDecimal.ONE,
            "eur", new BigDecimal("0.92"),
            "BRL", new BigDecimal("5.40")));

    @Test
    @DisplayName("Converts between two configured currencies through the pivot")
    void convertsThroughPivot() {
        assertThat(converter.convert(new BigDecimal("100"), "USD", "EUR")).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo("92.00"));
        assertThat(converter.convert(new BigDecimal("54"), "BRL", "USD")).hasValueSatisfying(
                v -> assertThat(v).isEqualByComparingTo("10.00"));
    }

    @Test
    @DisplayName("Returns empty for an unknown currency")
    void unknownCurrency() {
        assertThat(converter.convert(BigDecimal.TEN, "JPY", "USD")).isEmpty();
    }
}
