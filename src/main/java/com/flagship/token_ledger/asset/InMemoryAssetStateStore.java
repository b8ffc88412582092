package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Heap-backed {@link AssetStateStore}. State is lost on restart.
 */
public class InMemoryAssetStateStore implements AssetStateStore {

    private Asset asset;
    private FeatureState features = FeatureState.initial();
    private final Set<Address> whitelist = new LinkedHashSet<>();

    @Override
    public synchronized Optional<Asset> findAsset() {
        return Optional.ofNullable(asset);
    }

    @Override
    public synchronized boolean insertAsset(Asset asset) {
        if (this.asset != null) {
            return false;
        }
        this.asset = asset;
        this.features = FeatureState.initial();
        this.whitelist.clear();
        return true;
    }

    @Override
    public synchronized FeatureState loadFeatures() {
        return features;
    }

    @Override
    public synchronized void saveFeatures(FeatureState state) {
        this.features = state;
    }

    @Override
    public synchronized List<Address> loadWhitelist() {
        return List.copyOf(whitelist);
    }

    @Override
    public synchronized void addMembers(List<Address> addresses) {
        whitelist.addAll(addresses);
    }

    @Override
    public synchronized void removeMembers(List<Address> addresses) {
        addresses.forEach(whitelist::remove);
    }
}
