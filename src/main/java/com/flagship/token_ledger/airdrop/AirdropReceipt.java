package com.flagship.token_ledger.airdrop;

import lombok.Value;

/**
 * Outcome of a committed airdrop.
 */
@Value
public class AirdropReceipt {
    int recipientCount;
    long totalAmount;
}
