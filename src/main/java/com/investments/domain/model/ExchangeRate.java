package com.investments.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Cached exchange rate for one ordered currency pair
 */
public record ExchangeRate(
        String fromCurrency,
        String toCurrency,
        BigDecimal rate,
        Instant lastUpdated
) {

    /**
     * Decimal places kept for a stored rate
     */
    public static final int RATE_SCALE = 8;

    public CurrencyPair pair() {
        return new CurrencyPair(fromCurrency, toCurrency);
    }

    /**
     * A rate is fresh while its age does not exceed the window
     */
    public boolean isFresh(Instant now, Duration freshnessWindow) {
        return lastUpdated != null && !lastUpdated.plus(freshnessWindow).isBefore(now);
    }
}
