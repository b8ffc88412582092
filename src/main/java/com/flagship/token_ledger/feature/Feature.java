package com.flagship.token_ledger.feature;

/**
 * Switchable features of the asset.
 */
public enum Feature {
    AIRDROP,
    WHITELIST
}
