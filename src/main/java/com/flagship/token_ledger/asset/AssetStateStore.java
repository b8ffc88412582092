package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.feature.FeatureStore;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.whitelist.WhitelistStore;

import java.util.List;
import java.util.Optional;

/**
 * Everything per asset that is not a balance: the asset row itself, its feature
 * switches and its whitelist members.
 *
 * Key invariants:
 * - At most one asset is ever stored; {@link #insertAsset} never overwrites
 * - Inserting the asset also stores the initial feature state and an empty whitelist
 */
public interface AssetStateStore extends FeatureStore, WhitelistStore {

    Optional<Asset> findAsset();

    /**
     * @return false if an asset is already stored, in which case nothing is written
     */
    boolean insertAsset(Asset asset);

    /**
     * @return The stored switches, or {@link FeatureState#initial()} if no asset is stored
     */
    FeatureState loadFeatures();

    /**
     * @return Whitelist members in the order they were added
     */
    List<Address> loadWhitelist();
}
