package com.investments.infrastructure.persistence.repository;

import com.investments.infrastructure.persistence.entity.ExchangeRateEntity;
import io.quarkus.hibernate.reactive.panache.PanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Panache reactive repository for ExchangeRateEntity
 */
@ApplicationScoped
public class ExchangeRatePanacheRepository implements PanacheRepository<ExchangeRateEntity> {

    @WithSession
    public Uni<ExchangeRateEntity> findByPair(String fromCurrency, String toCurrency) {
        return find("fromCurrency = ?1 and toCurrency = ?2", fromCurrency, toCurrency).firstResult();
    }

    @WithSession
    public Uni<List<ExchangeRateEntity>> findUpdatedSince(OffsetDateTime since) {
        return find("lastUpdated >= ?1 ORDER BY fromCurrency, toCurrency", since).list();
    }

    @WithTransaction
    public Uni<ExchangeRateEntity> save(ExchangeRateEntity exchangeRate) {
        return persistAndFlush(exchangeRate);
    }
}
