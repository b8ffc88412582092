package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.ledger.Address;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the asset at startup when {@code ledger.asset.admin} is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetInitializer implements ApplicationRunner {

    private final AssetProperties properties;
    private final AssetRegistry assetRegistry;

    @Override
    public void run(ApplicationArguments args) {
        String admin = properties.getAdmin();
        if (admin == null || admin.isBlank()) {
            log.info("No administrator configured; asset awaits explicit initialization");
            return;
        }
        if (assetRegistry.isInitialized()) {
            Asset asset = assetRegistry.getMetadata();
            if (!asset.getAdmin().equals(Address.of(admin))) {
                log.warn("Configured administrator {} ignored; stored asset {} is administered by {}",
                    admin, asset.getId(), asset.getAdmin());
            }
            return;
        }
        assetRegistry.initialize(Address.of(admin));
    }
}
