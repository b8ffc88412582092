package com.flagship.token_ledger.whitelist;

import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Set of addresses eligible to receive airdrops.
 *
 * Batch mutations are all-or-nothing: the batch is applied to a staged copy in order,
 * and the copy replaces the live set only if every entry was valid and the batch has
 * been written to the {@link WhitelistStore}. A duplicate inside one batch counts like
 * a duplicate against the registry.
 *
 * Not thread-safe; callers hold the asset lock.
 */
public class WhitelistRegistry {

    private final WhitelistStore store;
    private Set<Address> members;

    public WhitelistRegistry() {
        this(List.of(), new WhitelistStore() {
            @Override
            public void addMembers(List<Address> addresses) {
            }

            @Override
            public void removeMembers(List<Address> addresses) {
            }
        });
    }

    public WhitelistRegistry(List<Address> stored, WhitelistStore store) {
        this.members = new LinkedHashSet<>(stored);
        this.store = store;
    }

    public boolean contains(Address address) {
        return members.contains(address);
    }

    public int size() {
        return members.size();
    }

    public List<Address> members() {
        return List.copyOf(members);
    }

    /**
     * Adds every address, or none.
     *
     * @throws LedgerException {@code INVALID_ADDRESS_LIST} if empty,
     *                         {@code ALREADY_WHITELISTED} on the first address already present
     */
    public void addMany(List<Address> addresses) {
        requireNonEmpty(addresses);
        Set<Address> staged = new LinkedHashSet<>(members);
        for (Address address : addresses) {
            if (!staged.add(address)) {
                throw LedgerException.alreadyWhitelisted(address);
            }
        }
        store.addMembers(addresses);
        members = staged;
    }

    /**
     * Removes every address, or none.
     *
     * @throws LedgerException {@code INVALID_ADDRESS_LIST} if empty,
     *                         {@code NOT_WHITELISTED} on the first address not present
     */
    public void removeMany(List<Address> addresses) {
        requireNonEmpty(addresses);
        Set<Address> staged = new LinkedHashSet<>(members);
        for (Address address : addresses) {
            if (!staged.remove(address)) {
                throw LedgerException.notWhitelisted(address);
            }
        }
        store.removeMembers(addresses);
        members = staged;
    }

    /**
     * Replaces the membership without writing it, e.g. after re-reading the store.
     */
    public void restore(List<Address> stored) {
        members = new LinkedHashSet<>(stored);
    }

    private static void requireNonEmpty(List<Address> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS_LIST, "Address list must not be empty");
        }
    }
}
