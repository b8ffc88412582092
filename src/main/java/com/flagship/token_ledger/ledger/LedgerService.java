package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.asset.AssetRegistry;
import com.flagship.token_ledger.asset.AuthorizationGuard;
import com.flagship.token_ledger.asset.Capability;
import com.flagship.token_ledger.asset.CapabilitySet;
import com.flagship.token_ledger.asset.LedgerState;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import com.flagship.token_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for minting, moving and burning units.
 *
 * This service enforces the core invariants:
 * 1. Only the administrator may mint, transfer or burn
 * 2. No holder's balance ever exceeds the per-holder cap
 * 3. Balances never go negative
 * 4. All checks run before any change reaches the balance store
 *
 * Every public operation runs through {@link AssetRegistry#execute}, i.e. under the asset
 * lock and inside its transaction, and stages its changes in a {@link StagedBalances}
 * unit of work that is committed only after all checks pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AssetRegistry assetRegistry;
    private final AuthorizationGuard authorizationGuard;
    private final SupplyCapPolicy supplyCapPolicy;
    private final BalanceStore balanceStore;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Creates {@code amount} new units in the balance of {@code to}.
     *
     * @return The new balance of {@code to}
     * @throws LedgerException PERMISSION_DENIED, INVALID_AMOUNT or CAPACITY_EXCEEDED
     */
    public long mint(Address caller, Address to, long amount) {
        return ledgerMetrics.record("mint", () -> assetRegistry.execute(state -> {
            CapabilitySet capabilities = authorizationGuard.requireAdmin(caller, state);
            requirePositive(amount);

            StagedBalances staged = new StagedBalances(balanceStore);
            supplyCapPolicy.checkCap(state.getAsset(), to, staged.balanceOf(to), amount);

            capabilities.mint().exercise(Capability.Kind.MINT, state.getAsset());
            staged.credit(to, amount);
            staged.commit();

            ledgerMetrics.recordMinted(amount);
            long balance = staged.balanceOf(to);
            log.info("Minted: to={}, amount={}, balance={}", to, amount, balance);
            return balance;
        }));
    }

    /**
     * Moves {@code amount} units from {@code from} to {@code to} on the administrator's authority.
     *
     * @throws LedgerException PERMISSION_DENIED, INVALID_AMOUNT, INSUFFICIENT_BALANCE or CAPACITY_EXCEEDED
     */
    public void transfer(Address caller, Address from, Address to, long amount) {
        ledgerMetrics.record("transfer", () -> assetRegistry.execute(state -> {
            StagedBalances staged = new StagedBalances(balanceStore);
            stageTransfer(state, caller, from, to, amount, staged);
            staged.commit();
            log.info("Transferred: from={}, to={}, amount={}", from, to, amount);
            return null;
        }));
    }

    /**
     * Validates a transfer and records it in {@code staged} without committing.
     *
     * Used by batch operations that commit many transfers as one unit. The caller must
     * already hold the asset lock (i.e. run inside {@link AssetRegistry#execute}).
     */
    public void stageTransfer(LedgerState state, Address caller, Address from, Address to,
                              long amount, StagedBalances staged) {
        CapabilitySet capabilities = authorizationGuard.requireAdmin(caller, state);
        requirePositive(amount);

        long fromBalance = staged.balanceOf(from);
        if (fromBalance < amount) {
            throw LedgerException.insufficientBalance(from, fromBalance, amount);
        }

        capabilities.transfer().exercise(Capability.Kind.TRANSFER, state.getAsset());
        staged.debit(from, amount);
        // checked after the debit so a self-transfer sees its own outgoing amount
        supplyCapPolicy.checkCap(state.getAsset(), to, staged.balanceOf(to), amount);
        staged.credit(to, amount);
    }

    /**
     * Destroys {@code amount} units from the balance of {@code from}.
     *
     * @return The remaining balance of {@code from}
     * @throws LedgerException PERMISSION_DENIED, INVALID_AMOUNT or INSUFFICIENT_BALANCE
     */
    public long burn(Address caller, Address from, long amount) {
        return ledgerMetrics.record("burn", () -> assetRegistry.execute(state -> {
            CapabilitySet capabilities = authorizationGuard.requireAdmin(caller, state);
            requirePositive(amount);

            StagedBalances staged = new StagedBalances(balanceStore);
            capabilities.burn().exercise(Capability.Kind.BURN, state.getAsset());
            staged.debit(from, amount);
            staged.commit();

            ledgerMetrics.recordBurned(amount);
            long balance = staged.balanceOf(from);
            log.info("Burned: from={}, amount={}, balance={}", from, amount, balance);
            return balance;
        }));
    }

    /**
     * Current balance of {@code holder}. Read-only, no authorization required.
     */
    public long getBalance(Address holder) {
        return balanceStore.getBalance(holder);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw LedgerException.invalidAmount(amount);
        }
    }
}
