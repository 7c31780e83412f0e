package com.investments.application.service;

import com.investments.domain.model.Account;
import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.Holding;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.PriceResult;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Gain/loss arithmetic for holdings and accounts. A holding without a resolved price is valued
 * at cost, so its gain/loss is zero.
 */
@ApplicationScoped
public class PerformanceCalculator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENTAGE_SCALE = 2;

    public HoldingPerformance calculate(Holding holding, PriceResult priceResult) {
        BigDecimal totalInvested = holding.totalInvested();
        PriceResult.Priced priced = priceResult instanceof PriceResult.Priced p ? p : null;

        BigDecimal currentValue = priced != null
                ? holding.quantity().multiply(priced.price())
                : totalInvested;
        BigDecimal gainLoss = currentValue.subtract(totalInvested);

        return new HoldingPerformance(
                holding.id(),
                holding.name(),
                priceResult != null ? priceResult.symbol() : null,
                holding.category(),
                holding.currency(),
                holding.quantity(),
                holding.purchaseValue(),
                priced != null ? priced.price() : null,
                priced != null,
                priced != null ? priced.source() : null,
                totalInvested,
                currentValue,
                gainLoss,
                percentage(gainLoss, totalInvested)
        );
    }

    public AccountPerformance summarize(Account account, List<HoldingPerformance> holdings) {
        BigDecimal totalInvested = holdings.stream()
                .map(HoldingPerformance::totalInvested)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal currentValue = holdings.stream()
                .map(HoldingPerformance::currentValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal gainLoss = currentValue.subtract(totalInvested);

        return new AccountPerformance(
                account.id(),
                account.name(),
                account.sortOrder(),
                List.copyOf(holdings),
                totalInvested,
                currentValue,
                gainLoss,
                percentage(gainLoss, totalInvested)
        );
    }

    /**
     * {@code gainLoss / invested * 100} rounded half-up to two decimals, zero when nothing was invested
     */
    public static BigDecimal percentage(BigDecimal gainLoss, BigDecimal invested) {
        if (invested == null || invested.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PERCENTAGE_SCALE);
        }
        return gainLoss.multiply(ONE_HUNDRED).divide(invested, PERCENTAGE_SCALE, RoundingMode.HALF_UP);
    }
}
