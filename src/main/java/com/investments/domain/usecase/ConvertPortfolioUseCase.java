package com.investments.domain.usecase;

import com.investments.domain.model.ConvertedPortfolio;
import io.smallrye.mutiny.Uni;

/**
 * Use case for expressing a user's whole portfolio in a single currency
 */
public interface ConvertPortfolioUseCase {

    Uni<ConvertedPortfolio> convertPortfolio(Long userId, String targetCurrency);
}
