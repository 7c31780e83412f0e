package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.Holding;
import com.investments.domain.model.PriceResult;
import com.investments.domain.model.PriceSource;
import com.investments.domain.model.SecurityPrice;
import com.investments.domain.port.QuoteProvider;
import com.investments.domain.port.SecurityPriceRepository;
import com.investments.domain.usecase.GetSecurityPriceUseCase;
import com.investments.infrastructure.config.MarketDataConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves security prices from the price store, refreshing from the quote provider when
 * today's row is missing or older than the freshness window
 */
@ApplicationScoped
@Slf4j
public class SecurityPriceService implements GetSecurityPriceUseCase {

    private final SecurityPriceRepository securityPriceRepository;
    private final QuoteProvider quoteProvider;
    private final SymbolMapper symbolMapper;
    private final MarketDataConfig config;
    private final Clock clock;

    public SecurityPriceService(SecurityPriceRepository securityPriceRepository,
                                QuoteProvider quoteProvider,
                                SymbolMapper symbolMapper,
                                MarketDataConfig config,
                                Clock clock) {
        this.securityPriceRepository = securityPriceRepository;
        this.quoteProvider = quoteProvider;
        this.symbolMapper = symbolMapper;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<PriceResult> getCurrentPrice(Holding holding) {
        if (holding == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, "Holding cannot be null"));
        }

        if (holding.category() == null || !holding.category().isTradable()) {
            return Uni.createFrom().item(new PriceResult.NoPrice(null, PriceResult.Reason.NON_TRADABLE));
        }

        Optional<String> symbol = symbolMapper.mapToSymbol(holding);
        if (symbol.isEmpty()) {
            log.info("No symbol could be derived for holding {} '{}'", holding.id(), holding.name());
            return Uni.createFrom().item(new PriceResult.NoPrice(null, PriceResult.Reason.UNMAPPABLE_SYMBOL));
        }

        return getCurrentPrice(symbol.get());
    }

    Uni<PriceResult> getCurrentPrice(String symbol) {
        LocalDate today = LocalDate.now(clock);

        return securityPriceRepository.findBySymbolAndDate(symbol, today)
                .flatMap(stored -> {
                    if (stored != null && stored.isFresh(clock.instant(), config.priceFreshness())) {
                        log.debug("Using stored price {} for {} updated at {}",
                                stored.closePrice(), symbol, stored.updatedAt());
                        return Uni.createFrom().item(priced(stored, PriceSource.CACHE));
                    }

                    return fetchLatest(symbol, today)
                            .onItemOrFailure().transformToUni((latest, failure) -> {
                                if (failure != null) {
                                    return lastKnown(symbol, failure);
                                }
                                return store(List.of(latest))
                                        .map(ignored -> priced(latest, PriceSource.PROVIDER));
                            });
                });
    }

    @Override
    public Uni<List<SecurityPrice>> getPriceSeries(String symbol, LocalDate start, LocalDate end, boolean forceRefresh) {
        if (symbol == null || symbol.isBlank()) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.MarketData.INVALID_INPUT, "Symbol cannot be null or empty"));
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate rangeEnd = end != null ? end : today;
        LocalDate rangeStart = start != null ? start : rangeEnd.minusDays(config.defaultSeriesDays());

        if (rangeStart.isAfter(rangeEnd)) {
            return Uni.createFrom().failure(new ServiceException(
                    Errors.MarketData.INVALID_INPUT,
                    "Start date " + rangeStart + " is after end date " + rangeEnd));
        }

        String normalized = symbol.trim().toUpperCase(Locale.ROOT);

        return securityPriceRepository.findBySymbolBetween(normalized, rangeStart, rangeEnd)
                .flatMap(rows -> {
                    if (!forceRefresh && !isStale(rows, rangeEnd, today)) {
                        return Uni.createFrom().item(rows);
                    }

                    log.debug("Refreshing {} between {} and {} (forced: {})", normalized, rangeStart, rangeEnd, forceRefresh);
                    return quoteProvider.getDailyPrices(normalized, rangeStart, rangeEnd)
                            .onItemOrFailure().transformToUni((fetched, failure) -> {
                                if (failure != null) {
                                    log.warn("Could not refresh {} between {} and {}, serving {} stored rows: {}",
                                            normalized, rangeStart, rangeEnd, rows.size(), failure.getMessage());
                                    return Uni.createFrom().item(rows);
                                }
                                if (fetched.isEmpty()) {
                                    return Uni.createFrom().item(rows);
                                }
                                return store(fetched)
                                        .flatMap(ignored -> securityPriceRepository.findBySymbolBetween(
                                                normalized, rangeStart, rangeEnd));
                            });
                });
    }

    @Override
    public Uni<List<String>> getAvailableSymbols() {
        return securityPriceRepository.findDistinctSymbols();
    }

    /**
     * A stored range needs a refetch when it is empty, when it stops before a past or present end date,
     * or when its last row is today's and older than the freshness window.
     */
    private boolean isStale(List<SecurityPrice> rows, LocalDate end, LocalDate today) {
        if (rows.isEmpty()) {
            return true;
        }

        SecurityPrice latest = rows.stream()
                .max(Comparator.comparing(SecurityPrice::priceDate))
                .orElseThrow();

        if (latest.priceDate().isBefore(end) && !end.isAfter(today)) {
            return true;
        }

        return latest.priceDate().equals(today) && !latest.isFresh(clock.instant(), config.priceFreshness());
    }

    private Uni<SecurityPrice> fetchLatest(String symbol, LocalDate today) {
        return quoteProvider.getDailyPrices(symbol, today, today)
                .map(prices -> prices.stream()
                        .max(Comparator.comparing(SecurityPrice::priceDate))
                        .orElseThrow(() -> new ServiceException(
                                Errors.MarketData.PRICE_NOT_FOUND,
                                "No quote returned for " + symbol + " on " + today)));
    }

    private Uni<PriceResult> lastKnown(String symbol, Throwable failure) {
        return securityPriceRepository.findLatestBySymbol(symbol)
                .map(latest -> {
                    if (latest == null) {
                        log.info("No price available for {}: {}", symbol, failure.getMessage());
                        return new PriceResult.NoPrice(symbol, PriceResult.Reason.NO_DATA);
                    }

                    log.warn("Serving last known price {} for {} dated {} after refresh failure: {}",
                            latest.closePrice(), symbol, latest.priceDate(), failure.getMessage());
                    return priced(latest, PriceSource.LAST_KNOWN);
                });
    }

    private Uni<List<SecurityPrice>> store(List<SecurityPrice> prices) {
        Instant now = clock.instant();
        List<SecurityPrice> stamped = prices.stream()
                .map(price -> price.toBuilder().updatedAt(now).build())
                .toList();

        return securityPriceRepository.upsertAll(stamped)
                .onFailure(this::isConcurrentUpsert)
                .recoverWithItem(throwable -> {
                    log.warn("Prices for {} were stored concurrently, keeping the fetched values",
                            stamped.get(0).symbol());
                    return stamped;
                });
    }

    private boolean isConcurrentUpsert(Throwable throwable) {
        return throwable instanceof ServiceException serviceException
                && serviceException.getError() == Errors.Persistence.CONCURRENT_UPSERT;
    }

    private static PriceResult priced(SecurityPrice price, PriceSource source) {
        return new PriceResult.Priced(price.symbol(), price.closePrice(), price.priceDate(), source);
    }
}
