package com.investments.domain.model;

/**
 * Currencies a holding can be denominated in, with the ticker suffix of the home market
 */
public enum Currency {
    BRL(".SA"),
    CAD(".TO"),
    USD("");

    private final String exchangeSuffix;

    Currency(String exchangeSuffix) {
        this.exchangeSuffix = exchangeSuffix;
    }

    public String getExchangeSuffix() {
        return exchangeSuffix;
    }
}
