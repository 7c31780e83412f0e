package com.investments.domain.port;

import com.investments.domain.model.Account;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Read-only access to accounts and the holdings they carry
 */
public interface AccountRepository {

    Uni<List<Account>> findAllWithHoldings(Long userId);

    Uni<Account> findByIdWithHoldings(Long accountId);
}
