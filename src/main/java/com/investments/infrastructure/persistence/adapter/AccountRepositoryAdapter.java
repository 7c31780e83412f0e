package com.investments.infrastructure.persistence.adapter;

import com.investments.domain.model.Account;
import com.investments.domain.port.AccountRepository;
import com.investments.infrastructure.persistence.mapper.AccountEntityMapper;
import com.investments.infrastructure.persistence.repository.AccountPanacheRepository;
import io.quarkus.hibernate.reactive.panache.common.WithSession;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class AccountRepositoryAdapter implements AccountRepository {

    private final AccountPanacheRepository panacheRepository;
    private final AccountEntityMapper accountEntityMapper;

    public AccountRepositoryAdapter(AccountPanacheRepository panacheRepository,
                                    AccountEntityMapper accountEntityMapper) {
        this.panacheRepository = panacheRepository;
        this.accountEntityMapper = accountEntityMapper;
    }

    @Override
    @WithSession
    public Uni<List<Account>> findAllWithHoldings(Long userId) {
        return panacheRepository.findAllWithInvestments(userId)
                .map(entities -> entities.stream()
                        .map(accountEntityMapper::toDomain)
                        .toList());
    }

    @Override
    @WithSession
    public Uni<Account> findByIdWithHoldings(Long accountId) {
        return panacheRepository.findByIdWithInvestments(accountId)
                .map(entity -> entity != null ? accountEntityMapper.toDomain(entity) : null);
    }
}
