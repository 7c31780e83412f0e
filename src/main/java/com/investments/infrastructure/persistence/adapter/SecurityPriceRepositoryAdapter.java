package com.investments.infrastructure.persistence.adapter;

import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;
import com.investments.domain.model.SecurityPrice;
import com.investments.domain.port.SecurityPriceRepository;
import com.investments.infrastructure.persistence.entity.SecurityPriceEntity;
import com.investments.infrastructure.persistence.mapper.SecurityPriceEntityMapper;
import com.investments.infrastructure.persistence.repository.SecurityPricePanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@ApplicationScoped
public class SecurityPriceRepositoryAdapter implements SecurityPriceRepository {

    static final String SYMBOL_DATE_CONSTRAINT = "uk_security_prices_symbol_date";

    private final SecurityPricePanacheRepository panacheRepository;
    private final SecurityPriceEntityMapper securityPriceEntityMapper;

    public SecurityPriceRepositoryAdapter(SecurityPricePanacheRepository panacheRepository,
                                          SecurityPriceEntityMapper securityPriceEntityMapper) {
        this.panacheRepository = panacheRepository;
        this.securityPriceEntityMapper = securityPriceEntityMapper;
    }

    @Override
    @WithSession
    public Uni<SecurityPrice> findBySymbolAndDate(String symbol, LocalDate priceDate) {
        return panacheRepository.findBySymbolAndDate(symbol, priceDate)
                .map(entity -> entity != null ? securityPriceEntityMapper.toDomain(entity) : null);
    }

    @Override
    @WithSession
    public Uni<SecurityPrice> findLatestBySymbol(String symbol) {
        return panacheRepository.findLatestBySymbol(symbol)
                .map(entity -> entity != null ? securityPriceEntityMapper.toDomain(entity) : null);
    }

    @Override
    @WithSession
    public Uni<List<SecurityPrice>> findBySymbolBetween(String symbol, LocalDate start, LocalDate end) {
        return panacheRepository.findBySymbolBetween(symbol, start, end)
                .map(entities -> securityPriceEntityMapper.toDomain(entities));
    }

    @Override
    @WithTransaction
    public Uni<SecurityPrice> upsert(SecurityPrice price) {
        return upsertRow(price)
                .onFailure(this::isSymbolDateUniqueViolation)
                .transform(t -> concurrentUpsert(price.symbol(), t));
    }

    @Override
    @WithTransaction
    public Uni<List<SecurityPrice>> upsertAll(List<SecurityPrice> prices) {
        if (prices.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        return Multi.createFrom().iterable(prices)
                .onItem().transformToUniAndConcatenate(this::upsertRow)
                .collect().asList()
                .onFailure(this::isSymbolDateUniqueViolation)
                .transform(t -> concurrentUpsert(prices.get(0).symbol(), t));
    }

    @Override
    @WithSession
    public Uni<List<String>> findDistinctSymbols() {
        return panacheRepository.findDistinctSymbols();
    }

    private Uni<SecurityPrice> upsertRow(SecurityPrice price) {
        return panacheRepository.findBySymbolAndDate(price.symbol(), price.priceDate())
                .flatMap(existing -> {
                    SecurityPriceEntity entity;
                    if (existing != null) {
                        existing.update(price);
                        entity = existing;
                    } else {
                        entity = securityPriceEntityMapper.toEntity(price);
                    }
                    return panacheRepository.save(entity);
                })
                .map(entity -> securityPriceEntityMapper.toDomain(entity));
    }

    private boolean isSymbolDateUniqueViolation(Throwable t) {
        return UniqueViolations.isUniqueViolation(t, SYMBOL_DATE_CONSTRAINT);
    }

    private ServiceException concurrentUpsert(String symbol, Throwable cause) {
        log.warn("Price of {} was inserted concurrently", symbol);
        return new ServiceException(Errors.Persistence.CONCURRENT_UPSERT,
                "Security price already inserted concurrently", cause);
    }
}
