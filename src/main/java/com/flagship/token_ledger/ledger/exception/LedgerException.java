package com.flagship.token_ledger.ledger.exception;

import com.flagship.token_ledger.feature.Feature;
import com.flagship.token_ledger.ledger.Address;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejection of a ledger operation.
 *
 * Thrown before any state change is made visible; callers never need to clean up
 * after catching it. The {@link #getCode() code} identifies the rule that failed,
 * {@link #getDetails() details} carry the values involved.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;
    private final Map<String, String> details;

    public LedgerException(LedgerErrorCode code, String message) {
        this(code, message, Map.of());
    }

    public LedgerException(LedgerErrorCode code, String message, Map<String, String> details) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public LedgerErrorCode getCode() {
        return code;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    public static LedgerException permissionDenied(Address caller) {
        return new LedgerException(LedgerErrorCode.PERMISSION_DENIED,
            "Caller is not the asset administrator",
            Map.of("caller", String.valueOf(caller)));
    }

    public static LedgerException capacityExceeded(Address holder, long balance, long amount, long cap) {
        return new LedgerException(LedgerErrorCode.CAPACITY_EXCEEDED,
            String.format("Balance of %s would exceed cap: balance=%d, incoming=%d, cap=%d",
                holder, balance, amount, cap),
            Map.of("holder", holder.getValue(),
                "balance", Long.toString(balance),
                "amount", Long.toString(amount),
                "cap", Long.toString(cap)));
    }

    public static LedgerException insufficientBalance(Address holder, long balance, long amount) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance for %s: balance=%d, requested=%d", holder, balance, amount),
            Map.of("holder", holder.getValue(),
                "balance", Long.toString(balance),
                "amount", Long.toString(amount)));
    }

    public static LedgerException featureInactive(Feature feature) {
        return new LedgerException(LedgerErrorCode.FEATURE_INACTIVE,
            String.format("Feature %s is not enabled", feature),
            Map.of("feature", feature.name()));
    }

    public static LedgerException invalidAmount(long amount) {
        return new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
            "Amount must be positive: " + amount,
            Map.of("amount", Long.toString(amount)));
    }

    public static LedgerException missingAmount(int index, Address recipient) {
        return new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
            String.format("Amount missing for recipient %s at index %d", recipient, index),
            Map.of("index", Integer.toString(index),
                "recipient", recipient.getValue()));
    }

    public static LedgerException alreadyWhitelisted(Address address) {
        return new LedgerException(LedgerErrorCode.ALREADY_WHITELISTED,
            "Address is already whitelisted: " + address,
            Map.of("address", address.getValue()));
    }

    public static LedgerException notWhitelisted(Address address) {
        return new LedgerException(LedgerErrorCode.NOT_WHITELISTED,
            "Address is not whitelisted: " + address,
            Map.of("address", address.getValue()));
    }
}
