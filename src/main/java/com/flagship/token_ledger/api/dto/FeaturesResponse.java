package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.feature.FeatureState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeaturesResponse {

    @JsonProperty("airdrop_enabled")
    boolean airdropEnabled;

    @JsonProperty("whitelist_enabled")
    boolean whitelistEnabled;

    public static FeaturesResponse from(FeatureState state) {
        return FeaturesResponse.builder()
            .airdropEnabled(state.isAirdropEnabled())
            .whitelistEnabled(state.isWhitelistEnabled())
            .build();
    }
}
