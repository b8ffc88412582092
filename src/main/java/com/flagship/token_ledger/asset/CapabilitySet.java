package com.flagship.token_ledger.asset;

/**
 * The mint, transfer and burn capabilities of one asset.
 * Lives exactly as long as the asset; there is no way to destroy or replace it.
 */
public final class CapabilitySet {

    private final Capability mint;
    private final Capability transfer;
    private final Capability burn;

    private CapabilitySet(Capability mint, Capability transfer, Capability burn) {
        this.mint = mint;
        this.transfer = transfer;
        this.burn = burn;
    }

    static CapabilitySet issueFor(Asset asset) {
        return new CapabilitySet(
            new Capability(Capability.Kind.MINT, asset.getId()),
            new Capability(Capability.Kind.TRANSFER, asset.getId()),
            new Capability(Capability.Kind.BURN, asset.getId()));
    }

    public Capability mint() {
        return mint;
    }

    public Capability transfer() {
        return transfer;
    }

    public Capability burn() {
        return burn;
    }
}
