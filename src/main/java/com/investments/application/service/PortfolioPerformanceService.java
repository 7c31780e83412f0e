package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.Account;
import com.investments.domain.model.AccountPerformance;
import com.investments.domain.model.Holding;
import com.investments.domain.model.HoldingPerformance;
import com.investments.domain.model.PriceResult;
import com.investments.domain.port.AccountRepository;
import com.investments.domain.usecase.CalculatePerformanceUseCase;
import com.investments.domain.usecase.GetSecurityPriceUseCase;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@ApplicationScoped
@Slf4j
public class PortfolioPerformanceService implements CalculatePerformanceUseCase {

    private final AccountRepository accountRepository;
    private final GetSecurityPriceUseCase getSecurityPriceUseCase;
    private final PerformanceCalculator performanceCalculator;

    public PortfolioPerformanceService(AccountRepository accountRepository,
                                       GetSecurityPriceUseCase getSecurityPriceUseCase,
                                       PerformanceCalculator performanceCalculator) {
        this.accountRepository = accountRepository;
        this.getSecurityPriceUseCase = getSecurityPriceUseCase;
        this.performanceCalculator = performanceCalculator;
    }

    @Override
    public Uni<List<HoldingPerformance>> calculate(List<Holding> holdings) {
        if (holdings == null || holdings.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        // One lookup at a time, the reactive session does not allow concurrent operations
        return Multi.createFrom().iterable(holdings)
                .onItem().transformToUniAndConcatenate(holding -> resolvePrice(holding)
                        .map(price -> performanceCalculator.calculate(holding, price)))
                .collect().asList();
    }

    @Override
    public Uni<AccountPerformance> calculateAccount(Long accountId) {
        if (accountId == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.Performance.INVALID_INPUT, "Account id cannot be null"));
        }

        return accountRepository.findByIdWithHoldings(accountId)
                .onItem().ifNull().failWith(() -> new ServiceException(
                        Errors.Performance.ACCOUNT_NOT_FOUND, "Account not found: " + accountId))
                .flatMap(this::summarizeAccount);
    }

    @Override
    public Uni<List<AccountPerformance>> calculateAllAccounts(Long userId) {
        if (userId == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.Performance.INVALID_INPUT, "User id cannot be null"));
        }

        return accountRepository.findAllWithHoldings(userId)
                .flatMap(accounts -> Multi.createFrom().iterable(
                                accounts.stream().sorted(Account.DISPLAY_ORDER).toList())
                        .onItem().transformToUniAndConcatenate(this::summarizeAccount)
                        .collect().asList())
                .invoke(performances -> log.debug("Calculated performance of {} accounts for user {}",
                        performances.size(), userId));
    }

    private Uni<AccountPerformance> summarizeAccount(Account account) {
        return calculate(account.holdings())
                .map(holdings -> performanceCalculator.summarize(account, holdings));
    }

    private Uni<PriceResult> resolvePrice(Holding holding) {
        return getSecurityPriceUseCase.getCurrentPrice(holding)
                .onFailure().recoverWithItem(throwable -> {
                    log.error("Price lookup failed for holding {} '{}', valuing at cost",
                            holding.id(), holding.name(), throwable);
                    return new PriceResult.NoPrice(null, PriceResult.Reason.LOOKUP_FAILED);
                });
    }
}
