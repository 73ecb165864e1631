package com.finlens.insights.services.insights;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

import com.finlens.insights.dto.insights.InsightMetric;

import lombok.extern.slf4j.Slf4j;

/**
 * Locale-bound formatting for insight values. One instance per configured locale.
 */
@Slf4j
public class InsightFormatter {

    private final Locale locale;

    public InsightFormatter(Locale locale) {
        this.locale = locale != null ? locale : Locale.US;
    }

    public Locale getLocale() {
        return locale;
    }

    public String currency(BigDecimal amount, String currencyCode) {
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        NumberFormat nf = NumberFormat.getCurrencyInstance(locale);
        if (currencyCode != null) {
            try {
                nf.setCurrency(Currency.getInstance(currencyCode.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.debug("[InsightFormatter] Unknown currency code {}, formatting as plain number", currencyCode);
                return String.format(locale, "%,.2f %s", safe, currencyCode);
            }
        }
        return nf.format(safe);
    }

    public String percent(double value) {
        return String.format(locale, "%.1f%%", value);
    }

    public String signedPercent(double value) {
        return String.format(locale, "%+.1f%%", value);
    }

    public String ratio(double value) {
        return String.format(locale, "%.2fx", value);
    }

    public String months(double value) {
        return String.format(locale, "%.1f months", value);
    }

    public String days(long value) {
        return value == 1 ? "1 day" : value + " days";
    }

    public InsightMetric money(BigDecimal value, String currencyCode) {
        return InsightMetric.builder()
                .value(value)
                .formattedValue(currency(value, currencyCode))
                .currency(currencyCode)
                .build();
    }
}
