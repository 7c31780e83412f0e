package com.investments.domain.usecase;

import com.investments.domain.model.PortfolioDashboard;
import io.smallrye.mutiny.Uni;

public interface GetPortfolioDashboardUseCase {

    Uni<PortfolioDashboard> getDashboard(Long userId);

    /**
     * Drops the cached dashboard of the user. Callers mutating holdings must wait for completion before returning.
     */
    Uni<Void> invalidate(Long userId);
}
