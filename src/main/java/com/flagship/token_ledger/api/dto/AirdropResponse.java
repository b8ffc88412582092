package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.airdrop.AirdropReceipt;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AirdropResponse {

    @JsonProperty("recipient_count")
    int recipientCount;

    @JsonProperty("total_amount")
    long totalAmount;

    public static AirdropResponse from(AirdropReceipt receipt) {
        return AirdropResponse.builder()
            .recipientCount(receipt.getRecipientCount())
            .totalAmount(receipt.getTotalAmount())
            .build();
    }
}
