package com.investments.domain.usecase;

import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.Holding;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Use case for computing gain/loss of holdings at current market prices
 */
public interface CalculatePerformanceUseCase {

    Uni<List<HoldingPerformance>> calculate(List<Holding> holdings);

    Uni<AccountPerformance> calculateAccount(Long accountId);

    /**
     * Performance of every account of the user in display order
     */
    Uni<List<AccountPerformance>> calculateAllAccounts(Long userId);
}
