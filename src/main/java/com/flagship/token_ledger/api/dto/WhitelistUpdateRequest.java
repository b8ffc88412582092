package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for adding or removing whitelist members.
 * An empty address list is rejected by the ledger with INVALID_ADDRESS_LIST.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhitelistUpdateRequest {

    @NotNull(message = "addresses is required")
    @JsonProperty("addresses")
    private List<String> addresses;

    @NotNull(message = "add is required")
    @JsonProperty("add")
    private Boolean add;
}
