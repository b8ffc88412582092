package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for an airdrop.
 * {@code recipients} and {@code amounts} are parallel lists; a length mismatch is
 * reported by the ledger as LENGTH_MISMATCH rather than by bean validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AirdropRequest {

    @NotNull(message = "recipients is required")
    @JsonProperty("recipients")
    private List<String> recipients;

    @NotNull(message = "amounts is required")
    @JsonProperty("amounts")
    private List<@NotNull(message = "amounts must not contain null") Long> amounts;
}
