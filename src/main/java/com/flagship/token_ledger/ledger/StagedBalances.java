package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit of work over a {@link BalanceStore}.
 *
 * Credits and debits are validated against projected balances and recorded as
 * net deltas per holder; the store is not touched until {@link #commit()}.
 * Discarding an instance without committing discards every staged change.
 *
 * Commit applies debits before credits so the store never sees a negative
 * intermediate balance. If the store fails part-way, the deltas already applied
 * are reversed (newest first) and the original failure is rethrown.
 */
@Slf4j
public class StagedBalances {

    private final BalanceStore store;
    private final Map<Address, Long> committed = new LinkedHashMap<>();
    private final Map<Address, Long> deltas = new LinkedHashMap<>();
    private boolean closed;

    public StagedBalances(BalanceStore store) {
        this.store = store;
    }

    /**
     * Balance of {@code holder} as it would be after commit.
     */
    public long balanceOf(Address holder) {
        long base = committed.computeIfAbsent(holder, store::getBalance);
        return base + deltas.getOrDefault(holder, 0L);
    }

    public void credit(Address holder, long amount) {
        ensureOpen();
        deltas.merge(holder, amount, Math::addExact);
    }

    /**
     * @throws LedgerException with {@code INSUFFICIENT_BALANCE} if the projected balance is lower than {@code amount}
     */
    public void debit(Address holder, long amount) {
        ensureOpen();
        long projected = balanceOf(holder);
        if (projected < amount) {
            throw LedgerException.insufficientBalance(holder, projected, amount);
        }
        deltas.merge(holder, -amount, Math::addExact);
    }

    /**
     * Writes all staged deltas to the store, all or nothing.
     */
    public void commit() {
        ensureOpen();
        closed = true;

        List<Map.Entry<Address, Long>> ordered = new ArrayList<>();
        deltas.entrySet().stream().filter(e -> e.getValue() < 0).forEach(ordered::add);
        deltas.entrySet().stream().filter(e -> e.getValue() > 0).forEach(ordered::add);

        List<Map.Entry<Address, Long>> applied = new ArrayList<>();
        try {
            for (Map.Entry<Address, Long> delta : ordered) {
                apply(delta.getKey(), delta.getValue());
                applied.add(delta);
            }
        } catch (RuntimeException e) {
            log.error("Balance commit failed after {} of {} deltas, compensating: error={}",
                applied.size(), ordered.size(), e.getMessage());
            compensate(applied, e);
            throw e;
        }
    }

    private void compensate(List<Map.Entry<Address, Long>> applied, RuntimeException cause) {
        for (int i = applied.size() - 1; i >= 0; i--) {
            Map.Entry<Address, Long> delta = applied.get(i);
            try {
                apply(delta.getKey(), -delta.getValue());
            } catch (RuntimeException compensationFailure) {
                log.error("Compensation failed, balance of {} is off by {}",
                    delta.getKey(), delta.getValue(), compensationFailure);
                cause.addSuppressed(compensationFailure);
            }
        }
    }

    private void apply(Address holder, long delta) {
        if (delta > 0) {
            store.credit(holder, delta);
        } else if (delta < 0) {
            store.debit(holder, -delta);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Staged balances already committed");
        }
    }
}
