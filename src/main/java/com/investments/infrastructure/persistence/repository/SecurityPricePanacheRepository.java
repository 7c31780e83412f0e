package com.investments.infrastructure.persistence.repository;

import com.investments.infrastructure.persistence.entity.SecurityPriceEntity;
import io.quarkus.hibernate.reactive.panache.PanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.quarkus.hibernate.reactive.panache.common.WithTransaction;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;

/**
 * Panache reactive repository for SecurityPriceEntity
 */
@ApplicationScoped
public class SecurityPricePanacheRepository implements PanacheRepository<SecurityPriceEntity> {

    @WithSession
    public Uni<SecurityPriceEntity> findBySymbolAndDate(String symbol, LocalDate priceDate) {
        return find("symbol = ?1 and priceDate = ?2", symbol, priceDate).firstResult();
    }

    @WithSession
    public Uni<SecurityPriceEntity> findLatestBySymbol(String symbol) {
        return find("symbol = ?1 ORDER BY priceDate DESC", symbol).firstResult();
    }

    @WithSession
    public Uni<List<SecurityPriceEntity>> findBySymbolBetween(String symbol, LocalDate start, LocalDate end) {
        return find("symbol = ?1 and priceDate >= ?2 and priceDate <= ?3 ORDER BY priceDate", symbol, start, end).list();
    }

    @WithSession
    public Uni<List<String>> findDistinctSymbols() {
        return getSession()
                .flatMap(session -> session
                        .createQuery("SELECT DISTINCT p.symbol FROM SecurityPriceEntity p ORDER BY p.symbol", String.class)
                        .getResultList());
    }

    @WithTransaction
    public Uni<SecurityPriceEntity> save(SecurityPriceEntity price) {
        return persistAndFlush(price);
    }
}
