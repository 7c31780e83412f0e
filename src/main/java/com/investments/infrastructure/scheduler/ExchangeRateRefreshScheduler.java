package com.investments.infrastructure.scheduler;

import com.investments.domain.model.CurrencyPair;
import com.investments.domain.usecase.RefreshExchangeRatesUseCase;
import com.investments.infrastructure.config.MarketDataConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.common.vertx.VertxContext;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import io.vertx.core.Context;
import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background loop keeping the tracked exchange rates fresh. Runs a refresh cycle after the
 * initial delay and then at every interval; a failed cycle is retried with doubling backoff
 * before the loop goes back to waiting for the next tick.
 */
@ApplicationScoped
public class ExchangeRateRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateRefreshScheduler.class);

    enum State {
        IDLE,
        REFRESHING,
        STOPPED
    }

    private final RefreshExchangeRatesUseCase refreshExchangeRatesUseCase;
    private final MarketDataConfig config;
    private final Executor executor;
    private final Counter successfulCycles;
    private final Counter failedCycles;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private volatile Cancellable ticker;

    @Inject
    public ExchangeRateRefreshScheduler(RefreshExchangeRatesUseCase refreshExchangeRatesUseCase,
                                        MarketDataConfig config,
                                        MeterRegistry meterRegistry,
                                        Vertx vertx) {
        this(refreshExchangeRatesUseCase, config, meterRegistry, action -> {
            // Reactive persistence must run on a Vert.x context, ticks arrive on a worker thread
            Context context = VertxContext.getOrCreateDuplicatedContext(vertx);
            context.runOnContext(ignored -> action.run());
        });
    }

    ExchangeRateRefreshScheduler(RefreshExchangeRatesUseCase refreshExchangeRatesUseCase,
                                 MarketDataConfig config,
                                 MeterRegistry meterRegistry,
                                 Executor executor) {
        this.refreshExchangeRatesUseCase = refreshExchangeRatesUseCase;
        this.config = config;
        this.executor = executor;
        this.successfulCycles = Counter.builder("exchange.rate.refresh.cycles")
                .description("Number of exchange rate refresh cycles")
                .tag("outcome", "success")
                .register(meterRegistry);
        this.failedCycles = Counter.builder("exchange.rate.refresh.cycles")
                .description("Number of exchange rate refresh cycles")
                .tag("outcome", "failure")
                .register(meterRegistry);
    }

    void onStart(@Observes StartupEvent ev) {
        start();
    }

    void onStop(@Observes ShutdownEvent ev) {
        stop();
    }

    public synchronized void start() {
        if (!config.refresh().enabled()) {
            log.info("Exchange rate refresh is disabled");
            return;
        }
        if (ticker != null) {
            log.warn("Exchange rate refresh is already scheduled");
            return;
        }

        state.compareAndSet(State.STOPPED, State.IDLE);
        List<CurrencyPair> pairs = refreshExchangeRatesUseCase.trackedPairs();
        MarketDataConfig.Refresh refresh = config.refresh();
        log.info("Scheduling refresh of {} currency pairs in {} and then every {}",
                pairs.size(), refresh.initialDelay(), refresh.interval());

        ticker = Multi.createFrom().ticks()
                .startingAfter(refresh.initialDelay())
                .every(refresh.interval())
                .onOverflow().drop()
                .onItem().transformToUniAndConcatenate(tick -> runCycle(pairs))
                .subscribe().with(
                        refreshed -> log.debug("Refresh cycle finished, success: {}", refreshed),
                        failure -> log.error("Exchange rate refresh loop terminated", failure),
                        () -> log.info("Exchange rate refresh loop completed")
                );
    }

    public synchronized void stop() {
        state.set(State.STOPPED);
        if (ticker != null) {
            log.info("Stopping exchange rate refresh");
            ticker.cancel();
            ticker = null;
        }
    }

    State getState() {
        return state.get();
    }

    /**
     * Runs one refresh cycle including its retries. Emits whether the cycle succeeded; never fails.
     */
    Uni<Boolean> runCycle(List<CurrencyPair> pairs) {
        if (!state.compareAndSet(State.IDLE, State.REFRESHING)) {
            log.warn("Skipping refresh cycle, scheduler is {}", state.get());
            return Uni.createFrom().item(false);
        }

        return attempt(pairs, 0)
                .onTermination().invoke(() -> state.compareAndSet(State.REFRESHING, State.IDLE));
    }

    private Uni<Boolean> attempt(List<CurrencyPair> pairs, int retry) {
        return Uni.createFrom().voidItem()
                .emitOn(executor)
                .flatMap(ignored -> refreshExchangeRatesUseCase.updateAll(pairs))
                .invoke(summary -> {
                    if (summary.nothingRefreshed()) {
                        throw new IllegalStateException("None of " + summary.total() + " currency pairs could be refreshed");
                    }
                })
                .onItemOrFailure().transformToUni((summary, failure) -> {
                    if (failure == null) {
                        successfulCycles.increment();
                        log.info("Exchange rate refresh cycle succeeded, refreshed {} of {} pairs",
                                summary.refreshed().size(), summary.total());
                        return Uni.createFrom().item(true);
                    }

                    if (retry >= config.refresh().maxRetries() || state.get() == State.STOPPED) {
                        failedCycles.increment();
                        log.error("Exchange rate refresh failed after {} retries, waiting for next cycle", retry, failure);
                        return Uni.createFrom().item(false);
                    }

                    Duration delay = backoff(retry);
                    log.warn("Exchange rate refresh attempt {} failed, retrying in {}: {}",
                            retry + 1, delay, failure.getMessage());
                    return pause(delay)
                            .flatMap(ignored -> state.get() == State.STOPPED
                                    ? Uni.createFrom().item(false)
                                    : attempt(pairs, retry + 1));
                });
    }

    /**
     * Delay before retry number {@code retry + 1}: the initial backoff doubled for each earlier retry
     */
    Duration backoff(int retry) {
        return config.refresh().initialBackoff().multipliedBy(1L << retry);
    }

    Uni<Void> pause(Duration delay) {
        return Uni.createFrom().voidItem().onItem().delayIt().by(delay);
    }
}
