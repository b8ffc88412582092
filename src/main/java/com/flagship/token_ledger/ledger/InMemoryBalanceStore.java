package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link BalanceStore}. Balances are lost on restart.
 */
public class InMemoryBalanceStore implements BalanceStore {

    private final ConcurrentHashMap<Address, Long> balances = new ConcurrentHashMap<>();

    @Override
    public long getBalance(Address holder) {
        return balances.getOrDefault(holder, 0L);
    }

    @Override
    public void credit(Address holder, long amount) {
        balances.merge(holder, amount, Math::addExact);
    }

    @Override
    public void debit(Address holder, long amount) {
        balances.compute(holder, (key, current) -> {
            long balance = current == null ? 0L : current;
            if (balance < amount) {
                throw LedgerException.insufficientBalance(holder, balance, amount);
            }
            long remaining = balance - amount;
            return remaining == 0 ? null : remaining;
        });
    }

    /**
     * Non-zero balances at the time of the call.
     */
    public Map<Address, Long> snapshot() {
        return Map.copyOf(balances);
    }
}
