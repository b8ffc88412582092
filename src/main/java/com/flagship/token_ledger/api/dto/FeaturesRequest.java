package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for overwriting both feature switches.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeaturesRequest {

    @NotNull(message = "airdrop_enabled is required")
    @JsonProperty("airdrop_enabled")
    private Boolean airdropEnabled;

    @NotNull(message = "whitelist_enabled is required")
    @JsonProperty("whitelist_enabled")
    private Boolean whitelistEnabled;
}
