package com.flagship.token_ledger.asset;

import java.util.UUID;

/**
 * Authorization token for one privileged action on one asset.
 *
 * Instances are created only in this package, together with their {@link Asset}, and
 * cannot be copied, cloned or serialized. Identity comparison is the only equality.
 * The ledger reaches a capability only through {@link AuthorizationGuard#requireAdmin}.
 */
public final class Capability {

    public enum Kind {
        MINT,
        TRANSFER,
        BURN
    }

    private final Kind kind;
    private final UUID assetId;

    Capability(Kind kind, UUID assetId) {
        this.kind = kind;
        this.assetId = assetId;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Confirms that this token grants {@code expected} on the given asset.
     *
     * @throws IllegalStateException if the token is of another kind or belongs to another asset
     */
    public void exercise(Kind expected, Asset asset) {
        if (kind != expected || !assetId.equals(asset.getId())) {
            throw new IllegalStateException(
                String.format("%s capability of asset %s cannot authorize %s on asset %s",
                    kind, assetId, expected, asset.getId()));
        }
    }

    @Override
    public String toString() {
        return "Capability[" + kind + "]";
    }
}
