package com.investments.domain.model;

import java.math.BigDecimal;
import java.util.List;

public record ConvertedPortfolio(
        String targetCurrency,
        List<ConvertedHolding> holdings,
        BigDecimal totalValue
) {

    public record ConvertedHolding(
            Long holdingId,
            String name,
            String accountName,
            BigDecimal originalValue,
            Currency originalCurrency,
            BigDecimal convertedValue
    ) {
    }
}
