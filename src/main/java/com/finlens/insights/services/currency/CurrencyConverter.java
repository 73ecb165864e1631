package com.finlens.insights.services.currency;

import java.math.BigDecimal;
import java.util.Optional;

public interface CurrencyConverter {

    /**
     * @return the converted amount, or empty when no rate is known for the pair
     */
    Optional<BigDecimal> convert(BigDecimal amount, String fromCurrency, String toCurrency);
}
