package com.flagship.token_ledger.airdrop;

import com.flagship.token_ledger.asset.AssetRegistry;
import com.flagship.token_ledger.asset.AuthorizationGuard;
import com.flagship.token_ledger.asset.LedgerState;
import com.flagship.token_ledger.feature.Feature;
import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.BalanceStore;
import com.flagship.token_ledger.ledger.LedgerService;
import com.flagship.token_ledger.ledger.StagedBalances;
import com.flagship.token_ledger.ledger.SupplyCapPolicy;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Administrator-funded distribution to many whitelisted recipients in one operation.
 *
 * Key principles:
 * - Both the airdrop and the whitelist feature must be on; otherwise nothing happens
 * - The administrator's own balance funds every recipient
 * - The batch is one unit: every transfer is staged, and nothing reaches the balance
 *   store unless every recipient passes validation
 * - A recipient listed twice accumulates; the cap applies to the accumulated amount
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AirdropService {

    private final AssetRegistry assetRegistry;
    private final AuthorizationGuard authorizationGuard;
    private final SupplyCapPolicy supplyCapPolicy;
    private final LedgerService ledgerService;
    private final BalanceStore balanceStore;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Transfers {@code amounts[i]} from the caller to {@code recipients[i]} for every i.
     *
     * Global checks run once, in order: caller is administrator, airdrop enabled,
     * whitelist enabled, lists of equal length, batch not empty. Then for each recipient
     * in order: amount present, whitelisted, within cap, positive amount, and the transfer itself.
     *
     * @param caller     Administrator, also the funding source
     * @param recipients Ordered recipient addresses
     * @param amounts    Amount per recipient, parallel to {@code recipients}
     * @return Receipt with recipient count and total distributed
     * @throws LedgerException FEATURE_INACTIVE, LENGTH_MISMATCH, NOT_WHITELISTED, CAPACITY_EXCEEDED,
     *                         INVALID_AMOUNT, INSUFFICIENT_BALANCE, PERMISSION_DENIED or INVALID_ADDRESS_LIST
     */
    public AirdropReceipt airdrop(Address caller, List<Address> recipients, List<Long> amounts) {
        return ledgerMetrics.record("airdrop", () -> assetRegistry.execute(state -> {
            authorizationGuard.requireAdmin(caller, state);
            requireFeatures(state.getFeatureFlags().current());
            requireParallel(recipients, amounts);

            StagedBalances staged = new StagedBalances(balanceStore);
            long total = 0;
            for (int i = 0; i < recipients.size(); i++) {
                Address recipient = recipients.get(i);
                Long amount = amounts.get(i);
                if (amount == null) {
                    throw LedgerException.missingAmount(i, recipient);
                }
                stageRecipient(state, caller, recipient, amount, staged);
                total += amount;
            }
            staged.commit();

            ledgerMetrics.recordAirdrop(recipients.size());
            log.info("Airdrop committed: recipients={}, total={}, funder={}", recipients.size(), total, caller);
            return new AirdropReceipt(recipients.size(), total);
        }));
    }

    private void stageRecipient(LedgerState state, Address caller, Address recipient, long amount,
                                StagedBalances staged) {
        if (!state.getWhitelist().contains(recipient)) {
            throw LedgerException.notWhitelisted(recipient);
        }
        supplyCapPolicy.checkCap(state.getAsset(), recipient, staged.balanceOf(recipient), amount);
        if (amount <= 0) {
            throw LedgerException.invalidAmount(amount);
        }
        ledgerService.stageTransfer(state, caller, caller, recipient, amount, staged);
    }

    private static void requireFeatures(FeatureState features) {
        if (!features.isAirdropEnabled()) {
            throw LedgerException.featureInactive(Feature.AIRDROP);
        }
        if (!features.isWhitelistEnabled()) {
            throw LedgerException.featureInactive(Feature.WHITELIST);
        }
    }

    private static void requireParallel(List<Address> recipients, List<Long> amounts) {
        int recipientCount = recipients == null ? 0 : recipients.size();
        int amountCount = amounts == null ? 0 : amounts.size();
        if (recipientCount != amountCount) {
            throw new LedgerException(LedgerErrorCode.LENGTH_MISMATCH,
                String.format("Recipients and amounts differ in length: recipients=%d, amounts=%d",
                    recipientCount, amountCount),
                Map.of("recipients", Integer.toString(recipientCount),
                    "amounts", Integer.toString(amountCount)));
        }
        if (recipientCount == 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS_LIST, "Recipient list must not be empty");
        }
    }
}
