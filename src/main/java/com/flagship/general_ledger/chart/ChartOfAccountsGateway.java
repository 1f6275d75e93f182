package com.flagship.general_ledger.chart;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the chart of accounts.
 */
public interface ChartOfAccountsGateway {

    Optional<Account> findById(UUID accountId);

    /**
     * Accounts keyed by id. Ids with no account are simply absent from the map.
     */
    Map<UUID, Account> findAllById(Collection<UUID> accountIds);

    /**
     * Active accounts that allow entries, ordered by code.
     */
    List<Account> findPostableAccounts();
}
