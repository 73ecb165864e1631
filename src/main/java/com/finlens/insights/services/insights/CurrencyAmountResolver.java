package com.finlens.insights.services.insights;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.finlens.insights.entities.RecurringSeries;
import com.finlens.insights.entities.Transaction;
import com.finlens.insights.services.currency.CurrencyConverter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Expresses amounts in the base currency. A missing rate never fails a computation:
 * the raw amount is used and a warning is logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CurrencyAmountResolver {

    private final CurrencyConverter currencyConverter;

    public BigDecimal resolve(Transaction transaction, String baseCurrency) {
        if (transaction == null || transaction.getAmount() == null) {
            return BigDecimal.ZERO;
        }
        if (sameCurrency(transaction.getCurrency(), baseCurrency)) {
            return transaction.getAmount();
        }
        if (transaction.getConvertedAmount() != null) {
            return transaction.getConvertedAmount();
        }
        return toBase(transaction.getAmount(), transaction.getCurrency(), baseCurrency);
    }

    public BigDecimal toBase(BigDecimal amount, String currency, String baseCurrency) {
        if (amount == null) {
            return BigDecimal.ZERO;
        }
        if (sameCurrency(currency, baseCurrency)) {
            return amount;
        }
        return currencyConverter.convert(amount, currency, baseCurrency)
                .orElseGet(() -> {
                    log.warn("[CurrencyAmountResolver] No rate {} -> {}, using raw amount {}", currency, baseCurrency, amount);
                    return amount;
                });
    }

    public BigDecimal monthlyEquivalent(RecurringSeries series, String baseCurrency) {
        if (series == null || series.getAmount() == null || series.getFrequency() == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal monthly = series.getFrequency().toMonthly(series.getAmount());
        return toBase(monthly, series.getCurrency(), baseCurrency);
    }

    private static boolean sameCurrency(String currency, String baseCurrency) {
        return currency == null || baseCurrency == null || currency.equalsIgnoreCase(baseCurrency);
    }
}
