package com.finlens.insights.services.insights;

import java.math.BigDecimal;

/**
 * Current balance of an account, already in the base currency.
 */
@FunctionalInterface
public interface AccountBalanceLookup {

    BigDecimal balanceOf(String accountId);
}
