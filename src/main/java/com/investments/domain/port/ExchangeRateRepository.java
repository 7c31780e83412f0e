package com.investments.domain.port;

import com.investments.domain.model.CurrencyPair;
import com.investments.domain.model.ExchangeRate;
import io.smallrye.mutiny.Uni;

import java.time.Instant;
import java.util.List;

public interface ExchangeRateRepository {

    /**
     * Emits null when no row exists for the pair
     */
    Uni<ExchangeRate> findByPair(CurrencyPair pair);

    Uni<List<ExchangeRate>> findUpdatedSince(Instant since);

    /**
     * Inserts or updates the row of the rate's pair. A racing insert of the same pair fails with
     * {@code Errors.Persistence.CONCURRENT_UPSERT}.
     */
    Uni<ExchangeRate> upsert(ExchangeRate exchangeRate);
}
