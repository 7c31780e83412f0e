package com.investments.domain.model;

import java.math.BigDecimal;

/**
 * Category breakdown line of the dashboard. Totals never mix currencies.
 */
public record CategoryTotal(
        Category category,
        Currency currency,
        int count,
        BigDecimal totalInvested,
        BigDecimal currentValue
) {
}
