package com.flagship.token_ledger.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Reasons a ledger operation can be rejected.
 *
 * Every rejection aborts the whole operation before any balance or registry change
 * becomes visible. The HTTP status is what the REST layer answers with.
 */
public enum LedgerErrorCode {
    /** Caller is not the administrator of the asset. */
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    /** A post-operation balance would exceed the per-holder cap. */
    CAPACITY_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    /** A debit exceeds the current balance. */
    INSUFFICIENT_BALANCE(HttpStatus.UNPROCESSABLE_ENTITY),
    /** The airdrop or whitelist feature is switched off. */
    FEATURE_INACTIVE(HttpStatus.CONFLICT),
    /** Parallel recipient and amount lists differ in length. */
    LENGTH_MISMATCH(HttpStatus.BAD_REQUEST),
    /** A quantity is zero or negative where a positive one is required. */
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    /** An identity list is empty. */
    INVALID_ADDRESS_LIST(HttpStatus.BAD_REQUEST),
    ALREADY_WHITELISTED(HttpStatus.CONFLICT),
    NOT_WHITELISTED(HttpStatus.CONFLICT),
    /** No asset exists yet. */
    NOT_INITIALIZED(HttpStatus.CONFLICT),
    /** The asset has already been created. */
    ALREADY_INITIALIZED(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    LedgerErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
