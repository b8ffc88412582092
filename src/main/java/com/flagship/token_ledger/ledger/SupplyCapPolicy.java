package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.asset.Asset;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.springframework.stereotype.Component;

/**
 * No holder may end an operation above the asset's per-holder cap.
 * Pure check; evaluated before any mutation.
 */
@Component
public class SupplyCapPolicy {

    /**
     * @throws LedgerException with {@code CAPACITY_EXCEEDED} if {@code currentBalance + incomingAmount}
     *                         exceeds the asset's cap
     */
    public void checkCap(Asset asset, Address holder, long currentBalance, long incomingAmount) {
        long cap = asset.getMaxPerHolder();
        // compare against headroom so the sum never overflows
        if (incomingAmount > cap - currentBalance) {
            throw LedgerException.capacityExceeded(holder, currentBalance, incomingAmount, cap);
        }
    }
}
