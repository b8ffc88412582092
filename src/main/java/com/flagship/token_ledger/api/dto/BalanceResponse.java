package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("balance")
    long balance;
}
