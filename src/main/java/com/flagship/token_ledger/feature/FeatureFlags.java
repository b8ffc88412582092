package com.flagship.token_ledger.feature;

import com.flagship.token_ledger.ledger.exception.LedgerException;

/**
 * Mutable holder of the asset's {@link FeatureState}.
 * One instance per asset; updates replace the whole state at once, after the
 * new state has been written to the {@link FeatureStore}.
 */
public class FeatureFlags {

    private final FeatureStore store;
    private volatile FeatureState state;

    public FeatureFlags() {
        this(FeatureState.initial(), state -> { });
    }

    public FeatureFlags(FeatureState initial, FeatureStore store) {
        this.state = initial;
        this.store = store;
    }

    public FeatureState current() {
        return state;
    }

    public FeatureState update(boolean airdropEnabled, boolean whitelistEnabled) {
        FeatureState next = state.withFlags(airdropEnabled, whitelistEnabled);
        store.saveFeatures(next);
        state = next;
        return next;
    }

    /**
     * Replaces the state without writing it, e.g. after re-reading the store.
     */
    public void restore(FeatureState stored) {
        state = stored;
    }

    /**
     * @throws LedgerException with {@code FEATURE_INACTIVE} if the feature is switched off
     */
    public void require(Feature feature) {
        if (!state.isEnabled(feature)) {
            throw LedgerException.featureInactive(feature);
        }
    }
}
