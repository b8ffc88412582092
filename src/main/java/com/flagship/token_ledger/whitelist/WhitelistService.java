package com.flagship.token_ledger.whitelist;

import com.flagship.token_ledger.asset.AssetRegistry;
import com.flagship.token_ledger.asset.AuthorizationGuard;
import com.flagship.token_ledger.feature.Feature;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Administrator operations on the airdrop whitelist.
 *
 * Membership queries are always available to the administrator; membership changes
 * additionally require the whitelist feature to be enabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WhitelistService {

    private final AssetRegistry assetRegistry;
    private final AuthorizationGuard authorizationGuard;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws LedgerException PERMISSION_DENIED
     */
    public boolean isWhitelisted(Address caller, Address address) {
        return assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            return state.getWhitelist().contains(address);
        });
    }

    /**
     * @throws LedgerException PERMISSION_DENIED
     */
    public List<Address> listMembers(Address caller) {
        return assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            return state.getWhitelist().members();
        });
    }

    /**
     * Adds ({@code add == true}) or removes every address in {@code addresses}, or none of them.
     *
     * Checks, in order: caller is administrator, list is non-empty, whitelist feature is on,
     * then membership of each address.
     *
     * @return Number of whitelist members after the update
     * @throws LedgerException PERMISSION_DENIED, INVALID_ADDRESS_LIST, FEATURE_INACTIVE,
     *                         ALREADY_WHITELISTED or NOT_WHITELISTED
     */
    public int updateWhitelist(Address caller, List<Address> addresses, boolean add) {
        String operation = add ? "whitelist_add" : "whitelist_remove";
        return ledgerMetrics.record(operation, () -> assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            if (addresses == null || addresses.isEmpty()) {
                throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS_LIST, "Address list must not be empty");
            }
            state.getFeatureFlags().require(Feature.WHITELIST);

            WhitelistRegistry whitelist = state.getWhitelist();
            if (add) {
                whitelist.addMany(addresses);
            } else {
                whitelist.removeMany(addresses);
            }
            log.info("Whitelist updated: operation={}, addresses={}, members={}",
                operation, addresses.size(), whitelist.size());
            return whitelist.size();
        }));
    }
}
