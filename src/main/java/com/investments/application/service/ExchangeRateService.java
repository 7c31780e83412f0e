package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.CurrencyPair;
import com.investments.domain.model.ExchangeRate;
import com.investments.domain.port.ExchangeRateProvider;
import com.investments.domain.port.ExchangeRateRepository;
import com.investments.domain.usecase.GetExchangeRateUseCase;
import com.investments.domain.usecase.RefreshExchangeRatesUseCase;
import com.investments.infrastructure.config.MarketDataConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolves exchange rates from the rate store, falling back to the primary and then the
 * secondary provider when the stored rate is missing or stale
 */
@ApplicationScoped
@Slf4j
public class ExchangeRateService implements GetExchangeRateUseCase, RefreshExchangeRatesUseCase {

    private final ExchangeRateRepository exchangeRateRepository;
    private final ExchangeRateProvider primaryProvider;
    private final ExchangeRateProvider secondaryProvider;
    private final MarketDataConfig config;
    private final Clock clock;
    private final Counter primaryFailures;
    private final Counter secondaryFailures;
    private final Counter unavailableRates;

    public ExchangeRateService(ExchangeRateRepository exchangeRateRepository,
                               @Named("exchangeRateApi") ExchangeRateProvider primaryProvider,
                               @Named("yahooFinance") ExchangeRateProvider secondaryProvider,
                               MarketDataConfig config,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.exchangeRateRepository = exchangeRateRepository;
        this.primaryProvider = primaryProvider;
        this.secondaryProvider = secondaryProvider;
        this.config = config;
        this.clock = clock;
        this.primaryFailures = providerFailureCounter(meterRegistry, "primary");
        this.secondaryFailures = providerFailureCounter(meterRegistry, "secondary");
        this.unavailableRates = Counter.builder("exchange.rate.unavailable")
                .description("Number of rate lookups where no provider could deliver a rate")
                .register(meterRegistry);
    }

    @Override
    public Uni<Result> getRate(String fromCurrency, String toCurrency) {
        return Uni.createFrom().item(() -> new CurrencyPair(fromCurrency, toCurrency))
                .flatMap(pair -> {
                    if (pair.isIdentity()) {
                        return Uni.createFrom().item(identity(pair));
                    }

                    return exchangeRateRepository.findByPair(pair)
                            .flatMap(stored -> {
                                if (stored != null && stored.isFresh(clock.instant(), config.rateFreshness())) {
                                    log.debug("Using stored rate {} for {} updated at {}",
                                            stored.rate(), pair, stored.lastUpdated());
                                    return Uni.createFrom().item((Result) new Result.Available(
                                            pair.fromCurrency(), pair.toCurrency(), stored.rate(),
                                            stored.lastUpdated(), Source.CACHE));
                                }

                                log.debug("Stored rate for {} is {}, fetching from providers",
                                        pair, stored == null ? "missing" : "stale");
                                return fetchAndStore(pair);
                            });
                });
    }

    @Override
    public Uni<BigDecimal> convert(BigDecimal amount, String fromCurrency, String toCurrency) {
        if (amount == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.ExchangeRate.INVALID_INPUT, "Amount cannot be null"));
        }

        return getRate(fromCurrency, toCurrency)
                .map(result -> {
                    if (result instanceof Result.Available available) {
                        return available.source() == Source.IDENTITY
                                ? amount
                                : amount.multiply(available.rate());
                    }

                    Result.Unavailable unavailable = (Result.Unavailable) result;
                    log.error("Cannot convert {} from {} to {}: {}",
                            amount, unavailable.fromCurrency(), unavailable.toCurrency(), unavailable.reason());
                    throw new ServiceException(
                            Errors.ExchangeRate.NO_RATE_AVAILABLE,
                            "No exchange rate available for " + unavailable.fromCurrency() + "-" + unavailable.toCurrency()
                    );
                });
    }

    @Override
    public Uni<Map<String, BigDecimal>> getAllCurrentRates() {
        Instant since = clock.instant().minus(config.rateFreshness());

        return exchangeRateRepository.findUpdatedSince(since)
                .map(rates -> rates.stream()
                        .collect(Collectors.toMap(
                                rate -> rate.pair().code(),
                                ExchangeRate::rate,
                                (first, second) -> second,
                                TreeMap::new)));
    }

    @Override
    public Uni<RefreshSummary> updateAll(List<CurrencyPair> pairs) {
        log.info("Refreshing {} currency pairs", pairs.size());

        return Multi.createFrom().iterable(pairs)
                .onItem().transformToUniAndConcatenate(this::refresh)
                .collect().asList()
                .map(outcomes -> {
                    List<CurrencyPair> refreshed = outcomes.stream()
                            .filter(PairOutcome::refreshed)
                            .map(PairOutcome::pair)
                            .toList();
                    List<CurrencyPair> failed = outcomes.stream()
                            .filter(outcome -> !outcome.refreshed())
                            .map(PairOutcome::pair)
                            .toList();
                    return new RefreshSummary(refreshed, failed);
                })
                .invoke(summary -> {
                    if (summary.failed().isEmpty()) {
                        log.info("Refreshed all {} currency pairs", summary.refreshed().size());
                    } else {
                        log.warn("Refreshed {} of {} currency pairs, failed: {}",
                                summary.refreshed().size(), summary.total(), summary.failed());
                    }
                });
    }

    @Override
    public Uni<RefreshSummary> updateAll() {
        return Uni.createFrom().item(this::trackedPairs)
                .flatMap(this::updateAll);
    }

    @Override
    public List<CurrencyPair> trackedPairs() {
        List<CurrencyPair> pairs = new ArrayList<>();
        for (String value : config.trackedPairs()) {
            try {
                pairs.add(CurrencyPair.parse(value));
            } catch (ServiceException e) {
                log.error("Ignoring invalid tracked currency pair '{}': {}", value, e.getMessage());
            }
        }
        return List.copyOf(pairs);
    }

    private Uni<PairOutcome> refresh(CurrencyPair pair) {
        if (pair.isIdentity()) {
            return Uni.createFrom().item(new PairOutcome(pair, true));
        }

        return fetchAndStore(pair)
                .onItemOrFailure().transform((result, failure) -> {
                    if (failure != null) {
                        log.error("Failed to refresh rate for {}", pair, failure);
                        return new PairOutcome(pair, false);
                    }
                    return new PairOutcome(pair, result instanceof Result.Available);
                });
    }

    /**
     * Calls the providers in fixed order and stores the first rate obtained. Provider failures
     * end in {@link Result.Unavailable}; store failures other than a racing insert propagate.
     */
    private Uni<Result> fetchAndStore(CurrencyPair pair) {
        return fetchFromProviders(pair)
                .onItemOrFailure().transformToUni((fetched, failure) -> {
                    if (failure != null) {
                        unavailableRates.increment();
                        log.error("No provider could deliver a rate for {}", pair, failure);
                        return Uni.createFrom().item((Result) new Result.Unavailable(
                                pair.fromCurrency(), pair.toCurrency(), failure.getMessage()));
                    }
                    return store(pair, fetched);
                });
    }

    private Uni<FetchedRate> fetchFromProviders(CurrencyPair pair) {
        return fetchFrom(primaryProvider, pair)
                .map(rate -> new FetchedRate(rate, Source.PRIMARY_PROVIDER))
                .onItem().invoke(fetched ->
                        log.info("Retrieved rate {} for {} from {}", fetched.rate(), pair, primaryProvider.name())
                )
                .onFailure().recoverWithUni(primaryError -> {
                    primaryFailures.increment();
                    log.warn("{} failed for {}, attempting {}: {}",
                            primaryProvider.name(), pair, secondaryProvider.name(), primaryError.getMessage());

                    return fetchFrom(secondaryProvider, pair)
                            .map(rate -> new FetchedRate(rate, Source.SECONDARY_PROVIDER))
                            .onItem().invoke(fetched ->
                                    log.info("Retrieved rate {} for {} from {}", fetched.rate(), pair, secondaryProvider.name())
                            )
                            .onFailure().invoke(secondaryError -> {
                                secondaryFailures.increment();
                                log.warn("{} failed for {}: {}", secondaryProvider.name(), pair, secondaryError.getMessage());
                            });
                });
    }

    private Uni<BigDecimal> fetchFrom(ExchangeRateProvider provider, CurrencyPair pair) {
        return Uni.createFrom().deferred(() -> provider.getRate(pair.fromCurrency(), pair.toCurrency()))
                .map(rate -> {
                    if (rate == null || rate.signum() <= 0) {
                        throw new ServiceException(
                                Errors.MarketData.PARSE_ERROR,
                                provider.name() + " returned invalid rate " + rate + " for " + pair
                        );
                    }
                    return rate;
                });
    }

    private Uni<Result> store(CurrencyPair pair, FetchedRate fetched) {
        // Same scale as the stored column so fetched and stored reads agree
        BigDecimal rate = fetched.rate().setScale(ExchangeRate.RATE_SCALE, RoundingMode.HALF_UP);
        ExchangeRate exchangeRate = new ExchangeRate(pair.fromCurrency(), pair.toCurrency(), rate, clock.instant());

        return exchangeRateRepository.upsert(exchangeRate)
                .onFailure(this::isConcurrentUpsert)
                .recoverWithItem(throwable -> {
                    log.warn("Rate for {} was stored concurrently, keeping the fetched value", pair);
                    return exchangeRate;
                })
                .map(saved -> new Result.Available(
                        pair.fromCurrency(), pair.toCurrency(), saved.rate(), saved.lastUpdated(), fetched.source()));
    }

    private boolean isConcurrentUpsert(Throwable throwable) {
        return throwable instanceof ServiceException serviceException
                && serviceException.getError() == Errors.Persistence.CONCURRENT_UPSERT;
    }

    private Result identity(CurrencyPair pair) {
        return new Result.Available(
                pair.fromCurrency(), pair.toCurrency(), BigDecimal.ONE, clock.instant(), Source.IDENTITY);
    }

    private static Counter providerFailureCounter(MeterRegistry meterRegistry, String role) {
        return Counter.builder("exchange.rate.provider.failures")
                .description("Number of failed exchange rate provider calls")
                .tag("provider", role)
                .register(meterRegistry);
    }

    private record FetchedRate(BigDecimal rate, Source source) {
    }

    private record PairOutcome(CurrencyPair pair, boolean refreshed) {
    }
}
