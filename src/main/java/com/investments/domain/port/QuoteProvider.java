package com.investments.domain.port;

import com.investments.domain.model.SecurityPrice;
import io.smallrye.mutiny.Uni;

import java.time.LocalDate;
import java.util.List;

/**
 * Port interface for daily quote sources
 */
public interface QuoteProvider {

    /**
     * Gets daily price rows for a symbol within the inclusive date range, ordered by date.
     * Trading days without a close are skipped.
     * @param symbol Exchange-qualified ticker (e.g., "SHOP.TO", "PETR4.SA")
     */
    Uni<List<SecurityPrice>> getDailyPrices(String symbol, LocalDate start, LocalDate end);
}
