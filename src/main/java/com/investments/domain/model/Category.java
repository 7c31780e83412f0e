package com.investments.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum Category {
    RENDA_FIXA,
    STOCKS,
    FIIS,
    ETF,
    BONDS,
    MANAGED_PORTFOLIO,
    CASH,
    MANAGED_PORTFOLIO_BLOCK;

    private static final Set<Category> TRADABLE = EnumSet.of(STOCKS, ETF, FIIS);

    /**
     * Whether holdings of this category have an exchange-listed market price
     */
    public boolean isTradable() {
        return TRADABLE.contains(this);
    }
}
