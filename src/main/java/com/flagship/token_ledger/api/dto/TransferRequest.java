package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotBlank(message = "Source address is required")
    @JsonProperty("from")
    private String from;

    @NotBlank(message = "Recipient address is required")
    @JsonProperty("to")
    private String to;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private Long amount;
}
