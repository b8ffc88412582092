package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Balances of both sides after a transfer.
 */
@Value
@Builder
public class TransferResponse {

    @JsonProperty("from")
    BalanceResponse from;

    @JsonProperty("to")
    BalanceResponse to;
}
