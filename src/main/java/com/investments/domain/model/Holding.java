package com.investments.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Investment held in an account. Read-only for the market data layer.
 */
public record Holding(
        Long id,
        Long accountId,
        String name,
        BigDecimal quantity,
        BigDecimal purchaseValue,
        Currency currency,
        Category category,
        LocalDate purchaseDate
) {

    public BigDecimal totalInvested() {
        return quantity.multiply(purchaseValue);
    }
}
