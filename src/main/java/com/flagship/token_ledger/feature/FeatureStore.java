package com.flagship.token_ledger.feature;

/**
 * Durable copy of the asset's {@link FeatureState}.
 */
public interface FeatureStore {

    void saveFeatures(FeatureState state);
}
