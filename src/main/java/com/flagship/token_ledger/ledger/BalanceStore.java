package com.flagship.token_ledger.ledger;

/**
 * Storage of per-holder quantities.
 *
 * Each call is atomic on its own. Balances are never negative: a debit that would
 * go below zero fails with {@code INSUFFICIENT_BALANCE} and leaves the balance as it was.
 * A holder that was never credited has balance zero.
 */
public interface BalanceStore {

    long getBalance(Address holder);

    void credit(Address holder, long amount);

    /**
     * @throws com.flagship.token_ledger.ledger.exception.LedgerException
     *         with {@code INSUFFICIENT_BALANCE} if the balance is lower than {@code amount}
     */
    void debit(Address holder, long amount);
}
