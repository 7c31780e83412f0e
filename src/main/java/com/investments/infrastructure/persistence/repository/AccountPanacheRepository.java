package com.investments.infrastructure.persistence.repository;

import com.investments.infrastructure.persistence.entity.AccountEntity;
import io.quarkus.hibernate.reactive.panache.PanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

/**
 * Read-only Panache reactive repository for AccountEntity
 */
@ApplicationScoped
public class AccountPanacheRepository implements PanacheRepository<AccountEntity> {

    @WithSession
    public Uni<List<AccountEntity>> findAllWithInvestments(Long userId) {
        return find("SELECT DISTINCT a FROM AccountEntity a LEFT JOIN FETCH a.investments "
                + "WHERE a.userId = ?1 ORDER BY a.sortOrder, a.name", userId).list();
    }

    @WithSession
    public Uni<AccountEntity> findByIdWithInvestments(Long id) {
        // No row limit with a collection fetch, the limit would be applied in memory
        return find("SELECT a FROM AccountEntity a LEFT JOIN FETCH a.investments WHERE a.id = ?1", id)
                .list()
                .map(accounts -> accounts.isEmpty() ? null : accounts.get(0));
    }
}
