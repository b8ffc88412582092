package com.flagship.token_ledger.ledger;

import lombok.Value;

/**
 * Identity of a holder (or of the administrator) in the ledger.
 *
 * Addresses are opaque: the ledger never interprets them, it only compares them.
 * Authentication of the identity behind an address happens upstream.
 */
@Value
public class Address {

    public static final int MAX_LENGTH = 128;

    String value;

    private Address(String value) {
        this.value = value;
    }

    /**
     * Creates an address from its textual form.
     *
     * @throws IllegalArgumentException if the value is blank or longer than {@link #MAX_LENGTH}
     */
    public static Address of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Address exceeds %d characters: %s...", MAX_LENGTH, trimmed.substring(0, 16)));
        }
        return new Address(trimmed);
    }

    @Override
    public String toString() {
        return value;
    }
}
