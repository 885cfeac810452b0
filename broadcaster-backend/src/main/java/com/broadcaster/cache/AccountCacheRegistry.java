package com.broadcaster.cache;

import com.broadcaster.config.AccountIdentity;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link AccountSnapshot} per configured account, created empty at start-up and kept
 * in configuration order. The set of accounts never changes after construction.
 */
public final class AccountCacheRegistry {
    private final Map<String, AccountSnapshot> snapshots;
    private final List<AccountIdentity> accounts;

    public AccountCacheRegistry(List<AccountIdentity> accounts, Clock clock) {
        var byId = new LinkedHashMap<String, AccountSnapshot>();
        for (AccountIdentity account : accounts) {
            byId.put(account.id(), new AccountSnapshot(account, clock));
        }
        this.snapshots = Collections.unmodifiableMap(byId);
        this.accounts = List.copyOf(accounts);
    }

    public Optional<AccountSnapshot> get(String accountId) {
        return Optional.ofNullable(snapshots.get(accountId));
    }

    public AccountSnapshot require(AccountIdentity account) {
        AccountSnapshot snapshot = snapshots.get(account.id());
        if (snapshot == null) {
            throw new IllegalArgumentException("Unknown account: " + account.id());
        }
        return snapshot;
    }

    public Optional<AccountSnapshot> findByIndex(int accountIndex) {
        return accounts.stream()
            .filter(a -> a.accountIndex() == accountIndex)
            .findFirst()
            .map(a -> snapshots.get(a.id()));
    }

    public Collection<AccountSnapshot> all() {
        return snapshots.values();
    }

    public List<AccountIdentity> accounts() {
        return accounts;
    }

    public Optional<AccountSnapshot> primary() {
        return snapshots.values().stream().findFirst();
    }

    public int size() {
        return snapshots.size();
    }
}
