package com.investments.domain.model;

public enum PriceSource {
    /** Today's persisted row, inside the freshness window */
    CACHE,
    /** Fetched from the quote provider during this call */
    PROVIDER,
    /** Most recent persisted row served after a failed refresh, regardless of age */
    LAST_KNOWN
}
