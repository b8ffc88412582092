package com.flagship.token_ledger.feature;

import lombok.Value;

/**
 * Snapshot of the asset's feature switches.
 *
 * {@code paused} is stored and reported but no operation consults it.
 */
@Value
public class FeatureState {
    boolean airdropEnabled;
    boolean whitelistEnabled;
    boolean paused;

    public static FeatureState initial() {
        return new FeatureState(false, false, false);
    }

    /**
     * Returns a copy with both switches overwritten; {@code paused} is carried over.
     */
    public FeatureState withFlags(boolean airdropEnabled, boolean whitelistEnabled) {
        return new FeatureState(airdropEnabled, whitelistEnabled, this.paused);
    }

    public boolean isEnabled(Feature feature) {
        return switch (feature) {
            case AIRDROP -> airdropEnabled;
            case WHITELIST -> whitelistEnabled;
        };
    }
}
