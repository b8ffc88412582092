package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gate in front of every privileged operation.
 *
 * The returned {@link CapabilitySet} is lent for the duration of the call; it must not
 * be stored or handed out.
 */
@Component
@Slf4j
public class AuthorizationGuard {

    /**
     * @param caller Authenticated caller address (may be null if none was supplied)
     * @param state  State of the asset being operated on
     * @return The asset's capabilities
     * @throws LedgerException with {@code PERMISSION_DENIED} if caller is not the administrator
     */
    public CapabilitySet requireAdmin(Address caller, LedgerState state) {
        if (!state.getAsset().isAdmin(caller)) {
            log.warn("Privileged operation denied: caller={}", caller);
            throw LedgerException.permissionDenied(caller);
        }
        return state.capabilities();
    }
}
