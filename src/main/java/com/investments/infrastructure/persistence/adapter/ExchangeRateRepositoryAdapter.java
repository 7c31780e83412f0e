package com.investments.infrastructure.persistence.adapter;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.CurrencyPair;
import com.investments.domain.model.ExchangeRate;
import com.investments.domain.port.ExchangeRateRepository;
import com.investments.infrastructure.persistence.entity.ExchangeRateEntity;
import com.investments.infrastructure.persistence.mapper.ExchangeRateEntityMapper;
import com.investments.infrastructure.persistence.repository.ExchangeRatePanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

@Slf4j
@ApplicationScoped
public class ExchangeRateRepositoryAdapter implements ExchangeRateRepository {

    static final String PAIR_CONSTRAINT = "uk_exchange_rates_pair";

    private final ExchangeRatePanacheRepository panacheRepository;
    private final ExchangeRateEntityMapper exchangeRateEntityMapper;

    public ExchangeRateRepositoryAdapter(ExchangeRatePanacheRepository panacheRepository,
                                         ExchangeRateEntityMapper exchangeRateEntityMapper) {
        this.panacheRepository = panacheRepository;
        this.exchangeRateEntityMapper = exchangeRateEntityMapper;
    }

    @Override
    @WithSession
    public Uni<ExchangeRate> findByPair(CurrencyPair pair) {
        return panacheRepository.findByPair(pair.fromCurrency(), pair.toCurrency())
                .map(entity -> entity != null ? exchangeRateEntityMapper.toDomain(entity) : null);
    }

    @Override
    @WithSession
    public Uni<List<ExchangeRate>> findUpdatedSince(Instant since) {
        return panacheRepository.findUpdatedSince(since.atOffset(ZoneOffset.UTC))
                .map(entities -> entities.stream()
                        .map(exchangeRateEntityMapper::toDomain)
                        .toList());
    }

    @Override
    @WithTransaction
    public Uni<ExchangeRate> upsert(ExchangeRate exchangeRate) {
        return panacheRepository.findByPair(exchangeRate.fromCurrency(), exchangeRate.toCurrency())
                .flatMap(existing -> {
                    ExchangeRateEntity entity;
                    if (existing != null) {
                        existing.update(exchangeRate);
                        entity = existing;
                    } else {
                        entity = exchangeRateEntityMapper.toEntity(exchangeRate);
                    }
                    return panacheRepository.save(entity);
                })
                .onFailure(t -> UniqueViolations.isUniqueViolation(t, PAIR_CONSTRAINT))
                .transform(t -> {
                    log.warn("Exchange rate {}-{} was inserted concurrently",
                            exchangeRate.fromCurrency(), exchangeRate.toCurrency());
                    return new ServiceException(Errors.Persistence.CONCURRENT_UPSERT,
                            "Exchange rate already inserted concurrently", t);
                })
                .map(exchangeRateEntityMapper::toDomain);
    }
}
