package com.investments.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated dashboard view for one user, the unit stored in the result cache
 */
public record PortfolioDashboard(
        Long userId,
        List<AccountPerformance> accounts,
        List<CategoryTotal> categories,
        Instant generatedAt
) {
}
