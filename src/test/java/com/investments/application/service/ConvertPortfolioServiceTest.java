package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.Account;
import com.investments.domain.model.Category;
import com.investments.domain.model.ConvertedPortfolio;
import com.investments.domain.model.Currency;
import com.investments.domain.model.Holding;
import com.investments.domain.port.AccountRepository;
import com.investments.domain.usecase.GetExchangeRateUseCase;
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
class ConvertPortfolioServiceTest {

    @Mock
    AccountRepository accountRepository;

    @Mock
    GetExchangeRateUseCase getExchangeRateUseCase;

    private ConvertPortfolioService service;

    @BeforeEach
    void setUp() {
        service = new ConvertPortfolioService(accountRepository, getExchangeRateUseCase);
    }

    @Test
    void testConvertPortfolio_ConvertsEveryHoldingInAccountOrder() {
        // Given
        Holding petr4 = holding(1L, "PETR4", "100", "30", Currency.BRL);
        Holding vfv = holding(2L, "VFV", "10", "100", Currency.CAD);
        Account brazil = new Account(2L, 1L, "Brazil", 1, List.of(petr4));
        Account tfsa = new Account(1L, 1L, "TFSA", 0, List.of(vfv));
        when(accountRepository.findAllWithHoldings(1L)).thenReturn(Uni.createFrom().item(List.of(brazil, tfsa)));
        when(getExchangeRateUseCase.convert(new BigDecimal("1000"), "CAD", "USD"))
                .thenReturn(Uni.createFrom().item(new BigDecimal("740")));
        when(getExchangeRateUseCase.convert(new BigDecimal("3000"), "BRL", "USD"))
                .thenReturn(Uni.createFrom().item(new BigDecimal("600")));

        // When
        ConvertedPortfolio portfolio = service.convertPortfolio(1L, " usd ")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals("USD", portfolio.targetCurrency());
        assertEquals(List.of(2L, 1L), portfolio.holdings().stream()
                .map(ConvertedPortfolio.ConvertedHolding::holdingId).toList());
        assertEquals("TFSA", portfolio.holdings().get(0).accountName());
        assertEquals(Currency.BRL, portfolio.holdings().get(1).originalCurrency());
        assertEquals(new BigDecimal("1340"), portfolio.totalValue());
    }

    @Test
    void testConvertPortfolio_MissingRate_FailsWholeConversion() {
        // Given
        Holding vfv = holding(2L, "VFV", "10", "100", Currency.CAD);
        when(accountRepository.findAllWithHoldings(1L))
                .thenReturn(Uni.createFrom().item(List.of(new Account(1L, 1L, "TFSA", 0, List.of(vfv)))));
        when(getExchangeRateUseCase.convert(new BigDecimal("1000"), "CAD", "BRL"))
                .thenReturn(Uni.createFrom().failure(new ServiceException(Errors.ExchangeRate.NO_RATE_AVAILABLE)));

        // When
        Throwable failure = service.convertPortfolio(1L, "BRL")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        ServiceException exception = assertInstanceOf(ServiceException.class, failure);
        assertEquals(Errors.ExchangeRate.NO_RATE_AVAILABLE, exception.getError());
    }

    @Test
    void testConvertPortfolio_InvalidTargetCurrency() {
        // When
        Throwable failure = service.convertPortfolio(1L, "dollars")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertFailed()
                .getFailure();

        // Then
        ServiceException exception = assertInstanceOf(ServiceException.class, failure);
        assertEquals(Errors.ExchangeRate.INVALID_INPUT, exception.getError());
        verifyNoInteractions(accountRepository);
    }

    @Test
    void testConvertPortfolio_NoAccounts() {
        // Given
        when(accountRepository.findAllWithHoldings(1L)).thenReturn(Uni.createFrom().item(List.of()));

        // When
        ConvertedPortfolio portfolio = service.convertPortfolio(1L, "CAD").await().indefinitely();

        // Then
        assertTrue(portfolio.holdings().isEmpty());
        assertEquals(BigDecimal.ZERO, portfolio.totalValue());
    }

    private static Holding holding(Long id, String name, String quantity, String purchaseValue, Currency currency) {
        return new Holding(id, 1L, name, new BigDecimal(quantity), new BigDecimal(purchaseValue),
                currency, Category.STOCKS, LocalDate.of(2023, 6, 1));
    }
}
