package com.investments.domain.usecase;

import com.investments.domain.model.Holding;
import com.investments.domain.model.PriceResult;
import com.investments.domain.model.SecurityPrice;
import io.smallrye.mutiny.Uni;

import java.time.LocalDate;
import java.util.List;

/**
 * Use case for resolving security prices
 */
public interface GetSecurityPriceUseCase {

    Uni<PriceResult> getCurrentPrice(Holding holding);

    /**
     * Daily rows for a symbol. Null {@code end} means today and null {@code start} means 30 days before {@code end}.
     */
    Uni<List<SecurityPrice>> getPriceSeries(String symbol, LocalDate start, LocalDate end, boolean forceRefresh);

    Uni<List<String>> getAvailableSymbols();
}
