package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.ledger.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity and metadata of the managed unit.
 * Created exactly once by {@link AssetRegistry#initialize(Address)} and never modified.
 */
@Value
public class Asset {
    UUID id;
    String symbol;
    String name;
    int decimals;
    long maxPerHolder;
    Address admin;
    Instant createdAt;

    public boolean isAdmin(Address caller) {
        return caller != null && admin.equals(caller);
    }
}
