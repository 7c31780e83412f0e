package com.investments.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.Category;
import com.investments.domain.model.CategoryTotal;
import com.investments.domain.model.Currency;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.PortfolioDashboard;
import com.investments.domain.port.ResultCache;
import com.investments.domain.usecase.CalculatePerformanceUseCase;
import com.investments.domain.usecase.GetPortfolioDashboardUseCase;
import com.investments.infrastructure.config.MarketDataConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-through cache of the per-user dashboard. The serialized dashboard is recomputed on a miss
 * and dropped explicitly whenever the user's holdings change.
 */
@ApplicationScoped
@Slf4j
public class PortfolioDashboardService implements GetPortfolioDashboardUseCase {

    static final String KEY_PREFIX = "dashboard:user:";

    private final CalculatePerformanceUseCase calculatePerformanceUseCase;
    private final ResultCache resultCache;
    private final ObjectMapper objectMapper;
    private final MarketDataConfig config;
    private final Clock clock;

    public PortfolioDashboardService(CalculatePerformanceUseCase calculatePerformanceUseCase,
                                     ResultCache resultCache,
                                     ObjectMapper objectMapper,
                                     MarketDataConfig config,
                                     Clock clock) {
        this.calculatePerformanceUseCase = calculatePerformanceUseCase;
        this.resultCache = resultCache;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<PortfolioDashboard> getDashboard(Long userId) {
        if (userId == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.Performance.INVALID_INPUT, "User id cannot be null"));
        }

        String key = cacheKey(userId);

        return resultCache.get(key)
                .flatMap(cached -> {
                    Optional<PortfolioDashboard> dashboard = cached.flatMap(json -> deserialize(key, json));
                    if (dashboard.isPresent()) {
                        log.debug("Dashboard cache hit for user {}", userId);
                        return Uni.createFrom().item(dashboard.get());
                    }

                    log.debug("Dashboard cache miss for user {}, recomputing", userId);
                    return compute(userId)
                            .call(computed -> store(key, computed));
                });
    }

    @Override
    public Uni<Void> invalidate(Long userId) {
        if (userId == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.Performance.INVALID_INPUT, "User id cannot be null"));
        }

        String key = cacheKey(userId);
        return resultCache.invalidate(key)
                .invoke(() -> log.info("Invalidated dashboard of user {}", userId));
    }

    static String cacheKey(Long userId) {
        return KEY_PREFIX + userId;
    }

    private Uni<PortfolioDashboard> compute(Long userId) {
        return calculatePerformanceUseCase.calculateAllAccounts(userId)
                .map(accounts -> new PortfolioDashboard(userId, accounts, categoryTotals(accounts), clock.instant()));
    }

    /**
     * Totals per category and currency, ordered by category then currency. Amounts in different
     * currencies are never added together.
     */
    private static List<CategoryTotal> categoryTotals(List<AccountPerformance> accounts) {
        Map<CategoryCurrency, List<HoldingPerformance>> grouped = accounts.stream()
                .flatMap(account -> account.holdings().stream())
                .filter(holding -> holding.category() != null && holding.currency() != null)
                .collect(Collectors.groupingBy(
                        holding -> new CategoryCurrency(holding.category(), holding.currency())));

        return grouped.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator
                        .comparing(CategoryCurrency::category)
                        .thenComparing(CategoryCurrency::currency)))
                .map(entry -> new CategoryTotal(
                        entry.getKey().category(),
                        entry.getKey().currency(),
                        entry.getValue().size(),
                        sum(entry.getValue(), HoldingPerformance::totalInvested),
                        sum(entry.getValue(), HoldingPerformance::currentValue)))
                .toList();
    }

    private static BigDecimal sum(List<HoldingPerformance> holdings, Function<HoldingPerformance, BigDecimal> amount) {
        return holdings.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private Uni<Void> store(String key, PortfolioDashboard dashboard) {
        String json;
        try {
            json = objectMapper.writeValueAsString(dashboard);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize dashboard for key {}, not caching it", key, e);
            return Uni.createFrom().voidItem();
        }
        return resultCache.put(key, json, config.cache().ttl());
    }

    private Optional<PortfolioDashboard> deserialize(String key, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, PortfolioDashboard.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached dashboard under {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private record CategoryCurrency(Category category, Currency currency) {
    }
}
