package com.investments.domain.model;

import java.math.BigDecimal;
import java.util.List;

public record AccountPerformance(
        Long accountId,
        String accountName,
        int sortOrder,
        List<HoldingPerformance> holdings,
        BigDecimal totalInvested,
        BigDecimal currentValue,
        BigDecimal totalGainLoss,
        BigDecimal totalGainLossPercentage
) {
}
