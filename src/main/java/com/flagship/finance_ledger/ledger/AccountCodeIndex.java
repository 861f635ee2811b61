package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.ledger.event.AccountCodeIndexEvent;
import com.flagship.finance_ledger.ledger.event.AccountCodeReservedEvent;
import com.flagship.finance_ledger.runtime.AlreadyExistsException;
import com.flagship.finance_ledger.runtime.EventSourcedEntity;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Account codes taken in one organization. A code belongs to exactly one account.
 */
public class AccountCodeIndex extends EventSourcedEntity<AccountCodeIndexEvent> {

    private final Map<String, UUID> accounts = new HashMap<>();

    /**
     * @throws AlreadyExistsException if another account already holds the code
     */
    public void requireAvailable(String accountCode, UUID accountId) {
        UUID holder = accounts.get(accountCode);
        if (holder != null && !holder.equals(accountId)) {
            throw new AlreadyExistsException("Account code " + accountCode + " already exists in organization");
        }
    }

    public void reserve(String accountCode, UUID accountId, Instant now) {
        requireAvailable(accountCode, accountId);
        if (!accounts.containsKey(accountCode)) {
            raise(new AccountCodeReservedEvent(accountCode, accountId, now));
        }
    }

    public Optional<UUID> findAccountId(String accountCode) {
        return Optional.ofNullable(accounts.get(accountCode));
    }

    @Override
    protected void apply(AccountCodeIndexEvent event) {
        if (event instanceof AccountCodeReservedEvent e) {
            accounts.put(e.getAccountCode(), e.getAccountId());
        }
    }
}
