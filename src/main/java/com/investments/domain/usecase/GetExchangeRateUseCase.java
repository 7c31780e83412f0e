package com.investments.domain.usecase;

import io.smallrye.mutiny.Uni;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Use case for resolving and applying currency exchange rates
 */
public interface GetExchangeRateUseCase {

    /**
     * Resolves the rate of an ordered pair from the store or, when stale or missing, from the providers.
     * Never fails for provider problems; emits {@link Result.Unavailable} instead.
     */
    Uni<Result> getRate(String fromCurrency, String toCurrency);

    /**
     * Converts an amount between currencies. Fails with {@code NO_RATE_AVAILABLE} when no rate can be resolved.
     */
    Uni<BigDecimal> convert(BigDecimal amount, String fromCurrency, String toCurrency);

    /**
     * Rates updated within the freshness window keyed by pair code (e.g., "CADUSD")
     */
    Uni<Map<String, BigDecimal>> getAllCurrentRates();

    sealed interface Result {
        record Available(String fromCurrency, String toCurrency, BigDecimal rate, Instant asOf, Source source)
                implements Result {}
        record Unavailable(String fromCurrency, String toCurrency, String reason) implements Result {}
    }

    enum Source {
        IDENTITY,
        CACHE,
        PRIMARY_PROVIDER,
        SECONDARY_PROVIDER
    }
}
