package com.flagship.token_ledger.feature;

import com.flagship.token_ledger.asset.AssetRegistry;
import com.flagship.token_ledger.asset.AuthorizationGuard;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Administrator access to the airdrop and whitelist switches.
 *
 * The two switches are independent: setting one never validates against the other.
 * Reading them is also restricted to the administrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureService {

    private final AssetRegistry assetRegistry;
    private final AuthorizationGuard authorizationGuard;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Overwrites both switches.
     *
     * @return The resulting state
     * @throws com.flagship.token_ledger.ledger.exception.LedgerException PERMISSION_DENIED
     */
    public FeatureState setFeatures(Address caller, boolean airdropEnabled, boolean whitelistEnabled) {
        return ledgerMetrics.record("set_features", () -> assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            FeatureState updated = state.getFeatureFlags().update(airdropEnabled, whitelistEnabled);
            log.info("Features updated: airdropEnabled={}, whitelistEnabled={}",
                updated.isAirdropEnabled(), updated.isWhitelistEnabled());
            return updated;
        }));
    }

    /**
     * @throws com.flagship.token_ledger.ledger.exception.LedgerException PERMISSION_DENIED
     */
    public FeatureState getFeatures(Address caller) {
        return assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            return state.getFeatureFlags().current();
        });
    }
}
