package com.investments.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.Category;
import com.investments.domain.model.CategoryTotal;
import com.investments.domain.model.Currency;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.PortfolioDashboard;
import com.investments.domain.model.PriceSource;
import com.investments.domain.port.ResultCache;
import com.investments.domain.usecase.CalculatePerformanceUseCase;
import com.investments.infrastructure.config.MarketDataConfig;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PortfolioDashboardServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-11T16:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private CalculatePerformanceUseCase calculatePerformanceUseCase;
    private ResultCache resultCache;
    private PortfolioDashboardService service;

    @BeforeEach
    void setUp() {
        calculatePerformanceUseCase = mock(CalculatePerformanceUseCase.class);
        resultCache = mock(ResultCache.class);

        MarketDataConfig config = mock(MarketDataConfig.class);
        MarketDataConfig.Cache cache = mock(MarketDataConfig.Cache.class);
        when(config.cache()).thenReturn(cache);
        when(cache.ttl()).thenReturn(Duration.ofHours(1));

        service = new PortfolioDashboardService(calculatePerformanceUseCase, resultCache, objectMapper,
                config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testGetDashboard_CacheHit_SkipsComputation() throws Exception {
        // Given
        PortfolioDashboard cached = new PortfolioDashboard(1L, List.of(account()), List.of(), NOW.minusSeconds(600));
        when(resultCache.get("dashboard:user:1"))
                .thenReturn(Uni.createFrom().item(Optional.of(objectMapper.writeValueAsString(cached))));

        // When
        PortfolioDashboard dashboard = service.getDashboard(1L)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals(cached, dashboard);
        verifyNoInteractions(calculatePerformanceUseCase);
        verify(resultCache, never()).put(anyString(), anyString(), any());
    }

    @Test
    void testGetDashboard_CacheMiss_ComputesAndStoresForOneHour() throws Exception {
        // Given
        when(resultCache.get("dashboard:user:1")).thenReturn(Uni.createFrom().item(Optional.empty()));
        when(resultCache.put(anyString(), anyString(), any())).thenReturn(Uni.createFrom().voidItem());
        when(calculatePerformanceUseCase.calculateAllAccounts(1L)).thenReturn(Uni.createFrom().item(List.of(account())));

        // When
        PortfolioDashboard dashboard = service.getDashboard(1L).await().indefinitely();

        // Then
        assertEquals(1L, dashboard.userId());
        assertEquals(NOW, dashboard.generatedAt());
        assertEquals(List.of(
                new CategoryTotal(Category.STOCKS, Currency.CAD, 1, new BigDecimal("50"), new BigDecimal("70")),
                new CategoryTotal(Category.ETF, Currency.CAD, 1, new BigDecimal("100"), new BigDecimal("100")),
                new CategoryTotal(Category.ETF, Currency.USD, 1, new BigDecimal("200"), new BigDecimal("180"))
        ), dashboard.categories());

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(resultCache).put(eq("dashboard:user:1"), json.capture(), eq(Duration.ofHours(1)));
        assertEquals(dashboard, objectMapper.readValue(json.getValue(), PortfolioDashboard.class));
        assertTrue(objectMapper.readTree(json.getValue())
                .at("/accounts/0/holdings/0/hasCurrentPrice").asBoolean());
    }

    @Test
    void testGetDashboard_UnreadableCacheEntry_Recomputes() {
        // Given
        when(resultCache.get("dashboard:user:1")).thenReturn(Uni.createFrom().item(Optional.of("{not json")));
        when(resultCache.put(anyString(), anyString(), any())).thenReturn(Uni.createFrom().voidItem());
        when(calculatePerformanceUseCase.calculateAllAccounts(1L)).thenReturn(Uni.createFrom().item(List.of()));

        // When
        PortfolioDashboard dashboard = service.getDashboard(1L).await().indefinitely();

        // Then
        assertTrue(dashboard.accounts().isEmpty());
        verify(calculatePerformanceUseCase).calculateAllAccounts(1L);
        verify(resultCache).put(eq("dashboard:user:1"), anyString(), eq(Duration.ofHours(1)));
    }

    @Test
    void testInvalidate_DeletesUserKey() {
        // Given
        when(resultCache.invalidate("dashboard:user:42")).thenReturn(Uni.createFrom().voidItem());

        // When
        service.invalidate(42L)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted();

        // Then
        verify(resultCache).invalidate("dashboard:user:42");
    }

    @Test
    void testInvalidate_FailurePropagates() {
        // Given
        when(resultCache.invalidate("dashboard:user:42"))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("redis down")));

        // When / Then
        service.invalidate(42L)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(IllegalStateException.class);
    }

    @Test
    void testGetDashboard_NullUser() {
        service.getDashboard(null)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailed();

        verifyNoInteractions(resultCache);
    }

    private static AccountPerformance account() {
        List<HoldingPerformance> holdings = List.of(
                holding(1L, Category.ETF, Currency.USD, "200", "180"),
                holding(2L, Category.STOCKS, Currency.CAD, "50", "70"),
                holding(3L, Category.ETF, Currency.CAD, "100", "100"));
        return new AccountPerformance(10L, "TFSA", 0, holdings,
                new BigDecimal("350"), new BigDecimal("350"), BigDecimal.ZERO, new BigDecimal("0.00"));
    }

    private static HoldingPerformance holding(Long id, Category category, Currency currency, String invested, String current) {
        BigDecimal totalInvested = new BigDecimal(invested);
        BigDecimal currentValue = new BigDecimal(current);
        BigDecimal gainLoss = currentValue.subtract(totalInvested);
        return new HoldingPerformance(id, "Holding " + id, null, category, currency, BigDecimal.ONE, totalInvested,
                currentValue, true, PriceSource.CACHE, totalInvested, currentValue, gainLoss,
                PerformanceCalculator.percentage(gainLoss, totalInvested));
    }
}
