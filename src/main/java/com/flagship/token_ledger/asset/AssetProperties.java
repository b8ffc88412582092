package com.flagship.token_ledger.asset;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "ledger.asset")
@Validated
@Data
public class AssetProperties {

    @NotBlank
    private String symbol = "CAP";

    @NotBlank
    private String name = "Capped Token";

    @Min(0)
    @Max(18)
    private int decimals = 0;

    /**
     * Largest balance any single holder may ever reach.
     */
    @Positive
    private long maxPerHolder = 100;

    /**
     * Administrator address. When set, the asset is created at startup;
     * otherwise it waits for an explicit initialize call.
     */
    private String admin;
}
