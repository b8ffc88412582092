package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.feature.FeatureFlags;
import com.flagship.token_ledger.whitelist.WhitelistRegistry;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything that exists per asset: the asset itself, its capabilities, its feature
 * switches and its whitelist. All four are created together and live together.
 *
 * The capability set has no public accessor; see {@link AuthorizationGuard}.
 */
public final class LedgerState {

    private final Asset asset;
    private final CapabilitySet capabilities;
    private final FeatureFlags featureFlags;
    private final WhitelistRegistry whitelist;
    private final ReentrantLock lock = new ReentrantLock();

    LedgerState(Asset asset, AssetStateStore store) {
        this.asset = asset;
        this.capabilities = CapabilitySet.issueFor(asset);
        this.featureFlags = new FeatureFlags(store.loadFeatures(), store);
        this.whitelist = new WhitelistRegistry(store.loadWhitelist(), store);
    }

    /**
     * Re-reads switches and whitelist from {@code store}, discarding in-memory changes
     * that never reached it.
     */
    void reload(AssetStateStore store) {
        featureFlags.restore(store.loadFeatures());
        whitelist.restore(store.loadWhitelist());
    }

    public Asset getAsset() {
        return asset;
    }

    public FeatureFlags getFeatureFlags() {
        return featureFlags;
    }

    public WhitelistRegistry getWhitelist() {
        return whitelist;
    }

    CapabilitySet capabilities() {
        return capabilities;
    }

    ReentrantLock lock() {
        return lock;
    }
}
