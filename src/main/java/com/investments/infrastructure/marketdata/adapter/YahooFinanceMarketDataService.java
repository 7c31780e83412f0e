package com.investments.infrastructure.marketdata.adapter;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.CurrencyPair;
import com.investments.domain.model.SecurityPrice;
import com.investments.domain.port.ExchangeRateProvider;
import com.investments.domain.port.QuoteProvider;
import com.investments.infrastructure.marketdata.client.YahooFinanceClient;
import com.investments.infrastructure.marketdata.dto.YahooChartResponse;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yahoo Finance implementation of QuoteProvider, also serving as the secondary exchange rate
 * source through the synthetic {@code FROMTO=X} chart symbols
 */
@ApplicationScoped
@Named("yahooFinance")
public class YahooFinanceMarketDataService implements ExchangeRateProvider, QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceMarketDataService.class);
    private static final String NAME = "Yahoo Finance";
    private static final String DAILY = "1d";
    private static final int PRICE_SCALE = 4;
    private static final int EXCHANGE_NAME_LENGTH = 10;

    @Inject
    @RestClient
    YahooFinanceClient yahooFinanceClient;

    @Override
    public Uni<BigDecimal> getRate(String fromCurrency, String toCurrency) {
        CurrencyPair pair;
        try {
            pair = new CurrencyPair(fromCurrency, toCurrency);
        } catch (ServiceException e) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, e.getMessage(), e));
        }

        String symbol = pair.chartSymbol();
        log.debug("Fetching rate for {} from {} as {}", pair, NAME, symbol);

        return yahooFinanceClient.getChart(symbol, DAILY, DAILY, null, null)
                .map(response -> {
                    YahooChartResponse.Result result = requireResult(response, symbol);

                    BigDecimal rate = result.meta() != null ? result.meta().regularMarketPrice() : null;
                    if (rate == null || rate.signum() <= 0) {
                        log.warn("No usable market price in {} response for {}: {}", NAME, symbol, rate);
                        throw new ServiceException(
                                Errors.MarketData.PARSE_ERROR,
                                "No usable rate from " + NAME + " for " + pair
                        );
                    }

                    log.info("Successfully retrieved rate {} for {} from {}", rate, pair, NAME);
                    return rate;
                })
                .onFailure().transform(throwable -> ProviderFailures.translate(NAME, symbol, throwable))
                .onFailure().invoke(throwable ->
                        log.error("Error fetching rate for {} from {}: {}", pair, NAME, throwable.getMessage())
                );
    }

    @Override
    public Uni<List<SecurityPrice>> getDailyPrices(String symbol, LocalDate start, LocalDate end) {
        if (symbol == null || symbol.trim().isEmpty()) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, "Symbol cannot be null or empty")
            );
        }
        if (start == null || end == null || start.isAfter(end)) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, "Invalid date range " + start + " to " + end)
            );
        }

        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        long period1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long period2 = end.atTime(LocalTime.MAX).toEpochSecond(ZoneOffset.UTC);

        log.debug("Fetching daily prices for {} between {} and {} from {}", normalized, start, end, NAME);

        return yahooFinanceClient.getChart(normalized, DAILY, null, period1, period2)
                .map(response -> toPrices(normalized, requireResult(response, normalized), start, end))
                .invoke(prices -> log.info("Retrieved {} daily prices for {} from {}", prices.size(), normalized, NAME))
                .onFailure().transform(throwable -> ProviderFailures.translate(NAME, normalized, throwable))
                .onFailure().invoke(throwable ->
                        log.error("Error fetching daily prices for {} from {}: {}", normalized, NAME, throwable.getMessage())
                );
    }

    @Override
    public String name() {
        return NAME;
    }

    private YahooChartResponse.Result requireResult(YahooChartResponse response, String symbol) {
        if (response == null) {
            throw new ServiceException(Errors.MarketData.PARSE_ERROR, "Empty response from " + NAME + " for " + symbol);
        }
        if (response.isError()) {
            YahooChartResponse.ChartError error = response.chart().error();
            log.warn("{} returned error for {}, code: {}, description: {}",
                    NAME, symbol, error.code(), error.description());
            throw new ServiceException(
                    Errors.MarketData.PRICE_NOT_FOUND,
                    NAME + " returned error for " + symbol + ": " + error.description()
            );
        }

        YahooChartResponse.Result result = response.firstResult();
        if (result == null) {
            throw new ServiceException(Errors.MarketData.PRICE_NOT_FOUND, "No chart data from " + NAME + " for " + symbol);
        }
        return result;
    }

    /**
     * One row per UTC trading date inside the range, skipping entries without a close. A later
     * entry for the same date (the live bar) replaces the earlier one.
     */
    private List<SecurityPrice> toPrices(String symbol, YahooChartResponse.Result result, LocalDate start, LocalDate end) {
        List<Long> timestamps = result.timestamp();
        if (timestamps == null || timestamps.isEmpty()
                || result.indicators() == null
                || result.indicators().quote() == null
                || result.indicators().quote().isEmpty()) {
            return List.of();
        }

        YahooChartResponse.Quote quote = result.indicators().quote().get(0);
        YahooChartResponse.Meta meta = result.meta();
        String currency = meta != null ? meta.currency() : null;
        String exchangeName = meta != null ? truncate(meta.exchangeName()) : null;

        Map<LocalDate, SecurityPrice> byDate = new TreeMap<>();
        for (int i = 0; i < timestamps.size(); i++) {
            BigDecimal close = scaled(valueAt(quote.close(), i));
            if (timestamps.get(i) == null || close == null) {
                continue;
            }

            LocalDate priceDate = LocalDate.ofInstant(Instant.ofEpochSecond(timestamps.get(i)), ZoneOffset.UTC);
            if (priceDate.isBefore(start) || priceDate.isAfter(end)) {
                continue;
            }

            byDate.put(priceDate, SecurityPrice.builder()
                    .symbol(symbol)
                    .priceDate(priceDate)
                    .openPrice(scaled(valueAt(quote.open(), i)))
                    .highPrice(scaled(valueAt(quote.high(), i)))
                    .lowPrice(scaled(valueAt(quote.low(), i)))
                    .closePrice(close)
                    .volume(valueAt(quote.volume(), i))
                    .currency(currency)
                    .exchangeName(exchangeName)
                    .build());
        }
        return new ArrayList<>(byDate.values());
    }

    private static <T> T valueAt(List<T> values, int index) {
        return values != null && index < values.size() ? values.get(index) : null;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value != null ? value.setScale(PRICE_SCALE, RoundingMode.HALF_UP) : null;
    }

    private static String truncate(String exchangeName) {
        if (exchangeName == null || exchangeName.length() <= EXCHANGE_NAME_LENGTH) {
            return exchangeName;
        }
        return exchangeName.substring(0, EXCHANGE_NAME_LENGTH);
    }
}
