package com.finlens.insights.entities;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Account {

    String id;
    String name;
    String currency;
    BigDecimal balance;
}
