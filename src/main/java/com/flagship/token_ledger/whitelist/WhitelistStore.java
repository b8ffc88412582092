package com.flagship.token_ledger.whitelist;

import com.flagship.token_ledger.ledger.Address;

import java.util.List;

/**
 * Durable copy of the whitelist membership.
 * Called only with batches {@link WhitelistRegistry} has already validated.
 */
public interface WhitelistStore {

    void addMembers(List<Address> addresses);

    void removeMembers(List<Address> addresses);
}
