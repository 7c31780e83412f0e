package com.investments.domain.port;

import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;

/**
 * Port interface for external exchange rate sources
 */
public interface ExchangeRateProvider {

    /**
     * Gets the current rate to convert one unit of {@code fromCurrency} into {@code toCurrency}.
     * Fails with a {@code ServiceException} when the provider cannot deliver a positive rate.
     */
    Uni<BigDecimal> getRate(String fromCurrency, String toCurrency);

    String name();
}
