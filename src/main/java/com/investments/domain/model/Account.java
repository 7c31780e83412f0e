package com.investments.domain.model;

import java.util.Comparator;
import java.util.List;

public record Account(
        Long id,
        Long userId,
        String name,
        int sortOrder,
        List<Holding> holdings
) {

    /**
     * Display order of accounts: explicit sort key, then name
     */
    public static final Comparator<Account> DISPLAY_ORDER = Comparator
            .comparingInt(Account::sortOrder)
            .thenComparing(Account::name, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Account::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public Account {
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
    }
}
