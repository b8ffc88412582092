package com.flagship.token_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.asset.Asset;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of the asset.
 *
 * {@code paused} is reported as stored; no operation acts on it.
 */
@Value
@Builder
public class MetadataResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("symbol")
    String symbol;

    @JsonProperty("name")
    String name;

    @JsonProperty("decimals")
    int decimals;

    @JsonProperty("max_per_holder")
    long maxPerHolder;

    @JsonProperty("admin")
    String admin;

    @JsonProperty("paused")
    boolean paused;

    @JsonProperty("created_at")
    Instant createdAt;

    public static MetadataResponse from(Asset asset, boolean paused) {
        return MetadataResponse.builder()
            .id(asset.getId())
            .symbol(asset.getSymbol())
            .name(asset.getName())
            .decimals(asset.getDecimals())
            .maxPerHolder(asset.getMaxPerHolder())
            .admin(asset.getAdmin().getValue())
            .paused(paused)
            .createdAt(asset.getCreatedAt())
            .build();
    }
}
