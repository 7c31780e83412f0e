package com.investments.domain.usecase;

import com.investments.domain.model.CurrencyPair;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Use case for refreshing tracked exchange rates in bulk
 */
public interface RefreshExchangeRatesUseCase {

    /**
     * Fetches every pair from the providers, ignoring freshness, and persists the results.
     * A failing pair is recorded in the summary and does not stop the batch.
     */
    Uni<RefreshSummary> updateAll(List<CurrencyPair> pairs);

    /**
     * Refreshes the configured tracked pairs
     */
    Uni<RefreshSummary> updateAll();

    /**
     * Configured tracked pairs in configuration order; invalid entries are skipped
     */
    List<CurrencyPair> trackedPairs();

    record RefreshSummary(List<CurrencyPair> refreshed, List<CurrencyPair> failed) {

        public RefreshSummary {
            refreshed = List.copyOf(refreshed);
            failed = List.copyOf(failed);
        }

        public int total() {
            return refreshed.size() + failed.size();
        }

        public boolean nothingRefreshed() {
            return total() > 0 && refreshed.isEmpty();
        }
    }
}
