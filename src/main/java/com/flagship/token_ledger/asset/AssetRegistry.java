package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owner of the single asset managed by this service.
 *
 * Key invariants:
 * - The asset, its capabilities, feature flags and whitelist are created in one step
 * - Creation happens at most once, also across restarts; there is no deletion path
 * - Every operation against the asset runs under the asset's lock, so no two
 *   operations interleave
 * - The lock is held until the operation's transaction has committed or rolled back
 *
 * A previously created asset is loaded from the {@link AssetStateStore} on first access.
 */
@Service
@Slf4j
public class AssetRegistry {

    private final AssetProperties properties;
    private final AssetStateStore stateStore;
    private final TransactionOperations transactionOperations;
    private final Object initializationMonitor = new Object();
    private volatile LedgerState state;
    private volatile boolean loaded;

    public AssetRegistry(AssetProperties properties) {
        this(properties, new InMemoryAssetStateStore(), TransactionOperations.withoutTransaction());
    }

    @Autowired
    public AssetRegistry(AssetProperties properties,
                         AssetStateStore stateStore,
                         ObjectProvider<TransactionOperations> transactionOperations) {
        this(properties, stateStore, transactionOperations.getIfAvailable(TransactionOperations::withoutTransaction));
    }

    public AssetRegistry(AssetProperties properties,
                         AssetStateStore stateStore,
                         TransactionOperations transactionOperations) {
        this.properties = properties;
        this.stateStore = stateStore;
        this.transactionOperations = transactionOperations;
    }

    /**
     * Creates the asset with {@code admin} as its administrator.
     *
     * @param admin Administrator address
     * @return The created asset
     * @throws LedgerException with {@code ALREADY_INITIALIZED} if an asset exists, here or in the store
     */
    public Asset initialize(Address admin) {
        if (admin == null) {
            throw new IllegalArgumentException("Administrator address is required");
        }
        synchronized (initializationMonitor) {
            LedgerState existing = loadState();
            if (existing != null) {
                throw alreadyInitialized(existing.getAsset());
            }
            Asset asset = new Asset(
                UUID.randomUUID(),
                properties.getSymbol(),
                properties.getName(),
                properties.getDecimals(),
                properties.getMaxPerHolder(),
                admin,
                Instant.now().truncatedTo(ChronoUnit.MICROS)
            );
            Boolean inserted = transactionOperations.execute(status -> stateStore.insertAsset(asset));
            if (!Boolean.TRUE.equals(inserted)) {
                // created by another instance since we last looked
                loaded = false;
                throw alreadyInitialized(loadState().getAsset());
            }
            state = new LedgerState(asset, stateStore);
            log.info("Asset initialized: assetId={}, symbol={}, admin={}, maxPerHolder={}",
                asset.getId(), asset.getSymbol(), admin, asset.getMaxPerHolder());
            return asset;
        }
    }

    public boolean isInitialized() {
        return loadState() != null;
    }

    /**
     * Returns the asset handle. Read-only, no authorization required.
     */
    public Asset getMetadata() {
        return requireState().getAsset();
    }

    public LedgerState requireState() {
        LedgerState current = loadState();
        if (current == null) {
            throw new LedgerException(LedgerErrorCode.NOT_INITIALIZED, "Asset has not been initialized");
        }
        return current;
    }

    /**
     * Runs {@code operation} with exclusive access to the asset's state, inside one
     * transaction when a transaction manager is configured.
     *
     * The lock is reentrant, so an operation may call other locked operations; nested
     * calls join the outer transaction.
     */
    public <T> T execute(Function<LedgerState, T> operation) {
        LedgerState current = requireState();
        ReentrantLock lock = current.lock();
        lock.lock();
        try {
            return transactionOperations.execute(status -> operation.apply(current));
        } catch (TransactionException e) {
            log.error("Transaction failed after the operation completed, reloading asset state: error={}",
                e.getMessage());
            current.reload(stateStore);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private LedgerState loadState() {
        LedgerState current = state;
        if (current != null || loaded) {
            return current;
        }
        synchronized (initializationMonitor) {
            if (state == null && !loaded) {
                state = stateStore.findAsset()
                    .map(asset -> {
                        log.info("Asset loaded from store: assetId={}, symbol={}, admin={}",
                            asset.getId(), asset.getSymbol(), asset.getAdmin());
                        return new LedgerState(asset, stateStore);
                    })
                    .orElse(null);
                loaded = true;
            }
            return state;
        }
    }

    private static LedgerException alreadyInitialized(Asset asset) {
        return new LedgerException(LedgerErrorCode.ALREADY_INITIALIZED,
            "Asset already initialized: " + asset.getSymbol(),
            Map.of("assetId", asset.getId().toString()));
    }
}
