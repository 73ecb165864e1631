package com.finlens.insights.services.currency;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.finlens.insights.config.InsightsProperties;

/**
 * Converts through a pivot currency using the rates in {@code insights.exchange-rates}
 * (units of each currency per one pivot unit).
 */
@Service
public class ConfiguredRatesCurrencyConverter implements CurrencyConverter {

    private final Map<String, BigDecimal> unitsPerPivot;

    @Autowired
    public ConfiguredRatesCurrencyConverter(InsightsProperties properties) {
        this(properties.exchangeRates());
    }

    public ConfiguredRatesCurrencyConverter(Map<String, BigDecimal> rates) {
        Map<String, BigDecimal> normalized = new HashMap<>();
        rates.forEach((code, rate) -> {
            if (code != null && rate != null && rate.signum() > 0) {
                normalized.put(code.trim().toUpperCase(Locale.ROOT), rate);
            }
        });
        this.unitsPerPivot = Map.copyOf(normalized);
    }

    @Override
    public Optional<BigDecimal> convert(BigDecimal amount, String fromCurrency, String toCurrency) {
        if (amount == null || fromCurrency == null || toCurrency == null) {
            return Optional.empty();
        }
        String from = fromCurrency.toUpperCase(Locale.ROOT);
        String to = toCurrency.toUpperCase(Locale.ROOT);
        if (from.equals(to)) {
            return Optional.of(amount);
        }
        BigDecimal fromRate = unitsPerPivot.get(from);
        BigDecimal toRate = unitsPerPivot.get(to);
        if (fromRate == null || toRate == null) {
            return Optional.empty();
        }
        BigDecimal converted = amount.divide(fromRate, MathContext.DECIMAL64).multiply(toRate);
        return Optional.of(converted.setScale(2, RoundingMode.HALF_UP));
    }
}
