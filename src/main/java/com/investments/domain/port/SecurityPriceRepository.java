package com.investments.domain.port;

import com.investments.domain.model.SecurityPrice;
import io.smallrye.mutiny.Uni;

import java.time.LocalDate;
import java.util.List;

public interface SecurityPriceRepository {

    Uni<SecurityPrice> findBySymbolAndDate(String symbol, LocalDate priceDate);

    /**
     * Most recent row of the symbol regardless of age, null when the symbol was never stored
     */
    Uni<SecurityPrice> findLatestBySymbol(String symbol);

    /**
     * Rows within the inclusive range, ordered by date
     */
    Uni<List<SecurityPrice>> findBySymbolBetween(String symbol, LocalDate start, LocalDate end);

    Uni<SecurityPrice> upsert(SecurityPrice price);

    Uni<List<SecurityPrice>> upsertAll(List<SecurityPrice> prices);

    Uni<List<String>> findDistinctSymbols();
}
