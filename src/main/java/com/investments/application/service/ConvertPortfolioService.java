package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.Account;
import com.investments.domain.model.ConvertedPortfolio;
import com.investments.domain.model.CurrencyPair;
import com.investments.domain.model.Holding;
import com.investments.domain.port.AccountRepository;
import com.investments.domain.usecase.ConvertPortfolioUseCase;
import com.investments.domain.usecase.GetExchangeRateUseCase;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Expresses every holding of a user in one target currency. Fails as a whole when any
 * holding's currency cannot be converted.
 */
@ApplicationScoped
@Slf4j
public class ConvertPortfolioService implements ConvertPortfolioUseCase {

    private final AccountRepository accountRepository;
    private final GetExchangeRateUseCase getExchangeRateUseCase;

    public ConvertPortfolioService(AccountRepository accountRepository,
                                   GetExchangeRateUseCase getExchangeRateUseCase) {
        this.accountRepository = accountRepository;
        this.getExchangeRateUseCase = getExchangeRateUseCase;
    }

    @Override
    public Uni<ConvertedPortfolio> convertPortfolio(Long userId, String targetCurrency) {
        if (userId == null) {
            return Uni.createFrom().failure(
                    new ServiceException(Errors.Performance.INVALID_INPUT, "User id cannot be null"));
        }

        return Uni.createFrom().item(() -> CurrencyPair.normalizeCode(targetCurrency))
                .flatMap(target -> accountRepository.findAllWithHoldings(userId)
                        .flatMap(accounts -> Multi.createFrom().iterable(
                                        accounts.stream().sorted(Account.DISPLAY_ORDER).toList())
                                .onItem().transformToMultiAndConcatenate(account -> Multi.createFrom()
                                        .iterable(account.holdings())
                                        .onItem().transformToUniAndConcatenate(holding -> convert(account, holding, target)))
                                .collect().asList())
                        .map(holdings -> new ConvertedPortfolio(
                                target,
                                holdings,
                                holdings.stream()
                                        .map(ConvertedPortfolio.ConvertedHolding::convertedValue)
                                        .reduce(BigDecimal.ZERO, BigDecimal::add))))
                .invoke(portfolio -> log.debug("Converted {} holdings of user {} to {}",
                        portfolio.holdings().size(), userId, portfolio.targetCurrency()));
    }

    private Uni<ConvertedPortfolio.ConvertedHolding> convert(Account account, Holding holding, String target) {
        BigDecimal invested = holding.totalInvested();

        return getExchangeRateUseCase.convert(invested, holding.currency().name(), target)
                .map(converted -> new ConvertedPortfolio.ConvertedHolding(
                        holding.id(),
                        holding.name(),
                        account.name(),
                        invested,
                        holding.currency(),
                        converted));
    }
}
