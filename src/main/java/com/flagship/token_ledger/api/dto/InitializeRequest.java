package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating the asset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitializeRequest {

    @NotBlank(message = "Administrator address is required")
    @JsonProperty("admin")
    private String admin;
}
