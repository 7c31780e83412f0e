package com.investments.domain.model;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered currency pair. CAD-USD and USD-CAD are distinct pairs.
 */
public record CurrencyPair(String fromCurrency, String toCurrency) {

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");

    public CurrencyPair {
        fromCurrency = normalizeCode(fromCurrency);
        toCurrency = normalizeCode(toCurrency);
    }

    /**
     * Parses "CAD-USD", "CAD/USD" or "CADUSD"
     */
    public static CurrencyPair parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Currency pair cannot be null or empty");
        }
        String compact = value.trim().replace("-", "").replace("/", "");
        if (compact.length() != 6) {
            throw new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Invalid currency pair: " + value);
        }
        return new CurrencyPair(compact.substring(0, 3), compact.substring(3));
    }

    public static String normalizeCode(String currency) {
        if (currency == null) {
            throw new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Currency cannot be null");
        }
        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_CODE.matcher(normalized).matches()) {
            throw new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Invalid currency code: " + currency);
        }
        return normalized;
    }

    public boolean isIdentity() {
        return fromCurrency.equals(toCurrency);
    }

    /**
     * Key used in rate listings, e.g. "CADUSD"
     */
    public String code() {
        return fromCurrency + toCurrency;
    }

    /**
     * Synthetic chart symbol used by quote providers, e.g. "CADUSD=X"
     */
    public String chartSymbol() {
        return code() + "=X";
    }

    @Override
    public String toString() {
        return fromCurrency + "-" + toCurrency;
    }
}
