package com.investments.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of a current price lookup. Absence of a price is a normal result, not an error.
 */
public sealed interface PriceResult {

    String symbol();

    record Priced(String symbol, BigDecimal price, LocalDate priceDate, PriceSource source) implements PriceResult {
    }

    record NoPrice(String symbol, Reason reason) implements PriceResult {
    }

    enum Reason {
        NON_TRADABLE,
        UNMAPPABLE_SYMBOL,
        NO_DATA,
        LOOKUP_FAILED
    }
}
