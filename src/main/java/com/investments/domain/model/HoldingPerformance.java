package com.investments.domain.model;

import java.math.BigDecimal;

/**
 * Gain/loss view of a single holding. {@code currentPrice} and {@code priceSource} are null
 * and {@code hasCurrentPrice} is false when no price could be resolved, in which case the
 * holding is valued at cost.
 */
public record HoldingPerformance(
        Long holdingId,
        String name,
        String symbol,
        Category category,
        Currency currency,
        BigDecimal quantity,
        BigDecimal purchasePrice,
        BigDecimal currentPrice,
        boolean hasCurrentPrice,
        PriceSource priceSource,
        BigDecimal totalInvested,
        BigDecimal currentValue,
        BigDecimal gainLoss,
        BigDecimal gainLossPercentage
) {
}
