package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.Account;
import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.Category;
import com.investments.domain.model.Currency;
import com.investments.domain.model.Holding;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.PriceResult;
import com.investments.domain.model.PriceSource;
import com.investments.domain.port.AccountRepository;
import com.investments.domain.usecase.GetSecurityPriceUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PortfolioPerformanceServiceTest {

    @Mock
    AccountRepository accountRepository;

    @Mock
    GetSecurityPriceUseCase getSecurityPriceUseCase;

    private PortfolioPerformanceService service;

    @BeforeEach
    void setUp() {
        service = new PortfolioPerformanceService(accountRepository, getSecurityPriceUseCase, new PerformanceCalculator());
    }

    @Test
    void testCalculate_PriceLookupFailure_ValuesHoldingAtCost() {
        // Given
        Holding vfv = holding(1L, 10L, "VFV", Category.ETF);
        Holding shop = holding(2L, 10L, "SHOP", Category.STOCKS);
        when(getSecurityPriceUseCase.getCurrentPrice(vfv)).thenReturn(Uni.createFrom().item(
                new PriceResult.Priced("VFV.TO", new BigDecimal("7"), LocalDate.of(2024, 3, 11), PriceSource.CACHE)));
        when(getSecurityPriceUseCase.getCurrentPrice(shop)).thenReturn(Uni.createFrom().failure(
                new IllegalStateException("session closed")));

        // When
        List<HoldingPerformance> performances = service.calculate(List.of(vfv, shop))
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals(2, performances.size());
        assertEquals(1L, performances.get(0).holdingId());
        assertEquals(0, new BigDecimal("70").compareTo(performances.get(0).currentValue()));
        assertEquals(2L, performances.get(1).holdingId());
        assertEquals(performances.get(1).totalInvested(), performances.get(1).currentValue());
        assertFalse(performances.get(1).hasCurrentPrice());
    }

    @Test
    void testCalculate_EmptyList() {
        List<HoldingPerformance> performances = service.calculate(List.of()).await().indefinitely();

        assertTrue(performances.isEmpty());
        verifyNoInteractions(getSecurityPriceUseCase);
    }

    @Test
    void testCalculateAccount_Success() {
        // Given
        Holding bond = holding(3L, 20L, "Tesouro IPCA 2035", Category.BONDS);
        when(accountRepository.findByIdWithHoldings(20L))
                .thenReturn(Uni.createFrom().item(new Account(20L, 1L, "Brazil", 1, List.of(bond))));
        when(getSecurityPriceUseCase.getCurrentPrice(bond))
                .thenReturn(Uni.createFrom().item(new PriceResult.NoPrice(null, PriceResult.Reason.NON_TRADABLE)));

        // When
        AccountPerformance performance = service.calculateAccount(20L).await().indefinitely();

        // Then
        assertEquals("Brazil", performance.accountName());
        assertEquals(1, performance.holdings().size());
        assertEquals(new BigDecimal("0.00"), performance.totalGainLossPercentage());
    }

    @Test
    void testCalculateAccount_NotFound() {
        // Given
        when(accountRepository.findByIdWithHoldings(99L)).thenReturn(Uni.createFrom().nullItem());

        // When
        Throwable failure = service.calculateAccount(99L)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        ServiceException exception = assertInstanceOf(ServiceException.class, failure);
        assertEquals(Errors.Performance.ACCOUNT_NOT_FOUND, exception.getError());
    }

    @Test
    void testCalculateAccount_NullId() {
        service.calculateAccount(null)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(ServiceException.class);

        verifyNoInteractions(accountRepository);
    }

    @Test
    void testCalculateAllAccounts_DeterministicOrder() {
        // Given
        Account zeta = new Account(1L, 7L, "Zeta", 0, List.of());
        Account alpha = new Account(2L, 7L, "Alpha", 0, List.of());
        Account first = new Account(3L, 7L, "Retirement", -1, List.of());
        Account later = new Account(4L, 7L, "Cash", 5, List.of());
        when(accountRepository.findAllWithHoldings(7L))
                .thenReturn(Uni.createFrom().item(List.of(zeta, later, alpha, first)));

        // When
        List<AccountPerformance> performances = service.calculateAllAccounts(7L).await().indefinitely();

        // Then
        assertEquals(List.of("Retirement", "Alpha", "Zeta", "Cash"),
                performances.stream().map(AccountPerformance::accountName).toList());
    }

    @Test
    void testCalculateAllAccounts_NullUser() {
        service.calculateAllAccounts(null)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(ServiceException.class);
    }

    private static Holding holding(Long id, Long accountId, String name, Category category) {
        return new Holding(id, accountId, name, new BigDecimal("10"), new BigDecimal("5"),
                Currency.CAD, category, LocalDate.of(2023, 1, 10));
    }
}
