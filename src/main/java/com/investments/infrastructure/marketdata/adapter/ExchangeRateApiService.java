package com.investments.infrastructure.marketdata.adapter;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.CurrencyPair;
import com.investments.domain.port.ExchangeRateProvider;
import com.investments.infrastructure.marketdata.client.ExchangeRateApiClient;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * ExchangeRate-API implementation of ExchangeRateProvider, the primary rate source
 */
@ApplicationScoped
@Named("exchangeRateApi")
public class ExchangeRateApiService implements ExchangeRateProvider {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateApiService.class);
    private static final String NAME = "ExchangeRate-API";

    @Inject
    @RestClient
    ExchangeRateApiClient exchangeRateApiClient;

    @Override
    public Uni<BigDecimal> getRate(String fromCurrency, String toCurrency) {
        CurrencyPair pair;
        try {
            pair = new CurrencyPair(fromCurrency, toCurrency);
        } catch (ServiceException e) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, e.getMessage(), e));
        }

        log.debug("Fetching {} rates from {}", pair.fromCurrency(), NAME);

        return exchangeRateApiClient.getLatestRates(pair.fromCurrency())
                .map(response -> {
                    if (response == null || response.rates() == null) {
                        log.error("Invalid response from {} for base: {}", NAME, pair.fromCurrency());
                        throw new ServiceException(
                                Errors.MarketData.PARSE_ERROR,
                                "Invalid response from " + NAME + " for base: " + pair.fromCurrency()
                        );
                    }

                    BigDecimal rate = response.rates().get(pair.toCurrency());
                    if (rate == null) {
                        log.warn("No {} rate in {} response for base: {}", pair.toCurrency(), NAME, pair.fromCurrency());
                        throw new ServiceException(
                                Errors.MarketData.PRICE_NOT_FOUND,
                                "No rate available from " + NAME + " for " + pair
                        );
                    }

                    if (rate.signum() <= 0) {
                        throw new ServiceException(
                                Errors.MarketData.PARSE_ERROR,
                                NAME + " returned non-positive rate " + rate + " for " + pair
                        );
                    }

                    log.info("Successfully retrieved rate {} for {} from {}", rate, pair, NAME);
                    return rate;
                })
                .onFailure().transform(throwable -> ProviderFailures.translate(NAME, pair.toString(), throwable))
                .onFailure().invoke(throwable ->
                        log.error("Error fetching rate for {} from {}: {}", pair, NAME, throwable.getMessage())
                );
    }

    @Override
    public String name() {
        return NAME;
    }
}
