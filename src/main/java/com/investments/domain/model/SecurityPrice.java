package com.investments.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Daily OHLC price row of a tradable security
 */
@Builder(toBuilder = true)
public record SecurityPrice(
        String symbol,
        LocalDate priceDate,
        BigDecimal openPrice,
        BigDecimal highPrice,
        BigDecimal lowPrice,
        BigDecimal closePrice,
        Long volume,
        String currency,
        String exchangeName,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isFresh(Instant now, Duration freshnessWindow) {
        return updatedAt != null && !updatedAt.plus(freshnessWindow).isBefore(now);
    }
}
