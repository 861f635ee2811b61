package com.flagship.finance_ledger.chart;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local chart of accounts, registered as the default {@link ChartOfAccounts}.
 */
@Slf4j
public class InMemoryChartOfAccounts implements ChartOfAccounts {

    private final Map<UUID, Map<String, ChartAccount>> accountsByOrganization = new ConcurrentHashMap<>();

    /**
     * Adds or updates the chart entry for the account's code. A code stays mapped to the
     * account it was first registered for.
     *
     * @throws IllegalStateException if the code is registered to a different account
     */
    public void register(UUID organizationId, ChartAccount account) {
        if (account.getAccountCode() == null || account.getAccountCode().isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        accountsByOrganization
            .computeIfAbsent(organizationId, id -> new ConcurrentHashMap<>())
            .merge(account.getAccountCode(), account, (existing, replacement) -> {
                if (!Objects.equals(existing.getAccountId(), replacement.getAccountId())) {
                    throw new IllegalStateException("Account code " + replacement.getAccountCode()
                        + " is already registered to account " + existing.getAccountId());
                }
                return replacement;
            });
        log.debug("Registered account {} for organization {}", account.getAccountCode(), organizationId);
    }

    @Override
    public boolean validateAccount(UUID organizationId, String accountCode) {
        return findAccount(organizationId, accountCode).map(ChartAccount::isActive).orElse(false);
    }

    @Override
    public Optional<ChartAccount> findAccount(UUID organizationId, String accountCode) {
        if (accountCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(accountsByOrganization.getOrDefault(organizationId, Map.of()).get(accountCode));
    }

    @Override
    public List<ChartAccount> getActiveAccounts(UUID organizationId) {
        return accountsByOrganization.getOrDefault(organizationId, Map.of()).values().stream()
            .filter(ChartAccount::isActive)
            .sorted((a, b) -> a.getAccountCode().compareTo(b.getAccountCode()))
            .toList();
    }
}
