package com.flagship.finance_ledger.chart;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The organization's account catalog. Owned outside the ledger core; the core only
 * validates codes against it and enumerates active accounts for year-end close.
 */
public interface ChartOfAccounts {

    /**
     * True if the code exists and is active.
     */
    boolean validateAccount(UUID organizationId, String accountCode);

    Optional<ChartAccount> findAccount(UUID organizationId, String accountCode);

    List<ChartAccount> getActiveAccounts(UUID organizationId);
}
