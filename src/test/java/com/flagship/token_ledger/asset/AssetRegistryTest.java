package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class AssetRegistryTest {

    private static final Address ADMIN = Address.of("0xA");
    private static final Address B = Address.of("0xB");
    private static final Address C = Address.of("0xC");

    private AssetProperties properties;
    private AssetRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new AssetProperties();
        properties.setSymbol("TST");
        properties.setMaxPerHolder(250);
        registry = new AssetRegistry(properties);
    }

    @Test
    @DisplayName("Initialize creates asset, capabilities, flags and whitelist together")
    void testInitialize() {
        Asset asset = registry.initialize(ADMIN);

        assertNotNull(asset.getId());
        assertEquals("TST", asset.getSymbol());
        assertEquals(250, asset.getMaxPerHolder());
        assertEquals(ADMIN, asset.getAdmin());
        assertSame(asset, registry.getMetadata());

        LedgerState state = registry.requireState();
        assertFalse(state.getFeatureFlags().current().isAirdropEnabled());
        assertFalse(state.getFeatureFlags().current().isWhitelistEnabled());
        assertFalse(state.getFeatureFlags().current().isPaused());
        assertEquals(0, state.getWhitelist().size());

        CapabilitySet capabilities = state.capabilities();
        assertDoesNotThrow(() -> capabilities.mint().exercise(Capability.Kind.MINT, asset));
        assertDoesNotThrow(() -> capabilities.transfer().exercise(Capability.Kind.TRANSFER, asset));
        assertDoesNotThrow(() -> capabilities.burn().exercise(Capability.Kind.BURN, asset));
    }

    @Test
    @DisplayName("Second initialize is rejected and keeps the original asset")
    void testInitializeOnce() {
        Asset first = registry.initialize(ADMIN);

        LedgerException e = assertThrows(LedgerException.class, () -> registry.initialize(Address.of("0xB")));

        assertEquals(LedgerErrorCode.ALREADY_INITIALIZED, e.getCode());
        assertSame(first, registry.getMetadata());
    }

    @Test
    @DisplayName("Concurrent initialize calls create exactly one asset")
    void testConcurrentInitialize() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            Address admin = Address.of("0x" + i);
            executor.submit(() -> {
                start.await();
                try {
                    registry.initialize(admin);
                    created.incrementAndGet();
                } catch (LedgerException e) {
                    rejected.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1, created.get());
        assertEquals(threads - 1, rejected.get());
    }

    @Test
    @DisplayName("Metadata before initialize is rejected")
    void testNotInitialized() {
        assertFalse(registry.isInitialized());
        LedgerException e = assertThrows(LedgerException.class, registry::getMetadata);
        assertEquals(LedgerErrorCode.NOT_INITIALIZED, e.getCode());
    }

    @Test
    @DisplayName("A capability cannot authorize another kind of action or another asset")
    void testCapabilityBinding() {
        Asset asset = registry.initialize(ADMIN);
        CapabilitySet capabilities = registry.requireState().capabilities();

        assertThrows(IllegalStateException.class,
            () -> capabilities.mint().exercise(Capability.Kind.BURN, asset));

        Asset other = new AssetRegistry(properties).initialize(ADMIN);
        assertThrows(IllegalStateException.class,
            () -> capabilities.mint().exercise(Capability.Kind.MINT, other));
    }

    @Test
    @DisplayName("A new registry over the same store restores asset, switches and whitelist")
    void testRestoreFromStore() {
        InMemoryAssetStateStore store = new InMemoryAssetStateStore();
        AssetRegistry first = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction());
        Asset asset = first.initialize(ADMIN);
        first.execute(state -> state.getFeatureFlags().update(true, true));
        first.execute(state -> {
            state.getWhitelist().addMany(List.of(C, B));
            return null;
        });

        AssetRegistry restarted = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction());

        assertTrue(restarted.isInitialized());
        assertEquals(asset, restarted.getMetadata());
        LedgerState state = restarted.requireState();
        assertEquals(new FeatureState(true, true, false), state.getFeatureFlags().current());
        assertEquals(List.of(C, B), state.getWhitelist().members());
    }

    @Test
    @DisplayName("Initialize after a restart is rejected, whoever asks")
    void testInitializeOnceAcrossRestart() {
        InMemoryAssetStateStore store = new InMemoryAssetStateStore();
        Asset original = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction())
            .initialize(ADMIN);

        AssetRegistry restarted = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction());
        LedgerException e = assertThrows(LedgerException.class, () -> restarted.initialize(B));

        assertEquals(LedgerErrorCode.ALREADY_INITIALIZED, e.getCode());
        assertEquals(original.getId().toString(), e.getDetails().get("assetId"));
        assertEquals(ADMIN, restarted.getMetadata().getAdmin());
    }

    @Test
    @DisplayName("Asset created elsewhere after the first look still blocks initialize")
    void testInitializeLosesRaceToOtherInstance() {
        InMemoryAssetStateStore store = new InMemoryAssetStateStore();
        AssetRegistry local = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction());
        assertFalse(local.isInitialized());

        Asset remote = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction())
            .initialize(B);

        LedgerException e = assertThrows(LedgerException.class, () -> local.initialize(ADMIN));
        assertEquals(LedgerErrorCode.ALREADY_INITIALIZED, e.getCode());
        assertEquals(remote, local.getMetadata());
    }

    @Test
    @DisplayName("Failed store write leaves switches and whitelist unchanged in memory")
    void testStoreWriteFailure() {
        InMemoryAssetStateStore store = spy(new InMemoryAssetStateStore());
        AssetRegistry failing = new AssetRegistry(properties, store, TransactionOperations.withoutTransaction());
        failing.initialize(ADMIN);
        doThrow(new IllegalStateException("connection reset")).when(store).saveFeatures(any());
        doThrow(new IllegalStateException("connection reset")).when(store).addMembers(anyList());

        LedgerState state = failing.requireState();
        assertThrows(IllegalStateException.class, () -> state.getFeatureFlags().update(true, true));
        assertThrows(IllegalStateException.class, () -> state.getWhitelist().addMany(List.of(B)));

        assertEquals(FeatureState.initial(), state.getFeatureFlags().current());
        assertFalse(state.getWhitelist().contains(B));
    }

    @Test
    @DisplayName("Failed commit reloads switches from the store")
    void testCommitFailureReloadsState() {
        AtomicBoolean failCommit = new AtomicBoolean();
        TransactionOperations transactions = new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                T result = action.doInTransaction(new SimpleTransactionStatus());
                if (failCommit.get()) {
                    throw new TransactionSystemException("commit failed");
                }
                return result;
            }
        };
        InMemoryAssetStateStore store = spy(new InMemoryAssetStateStore());
        AssetRegistry failing = new AssetRegistry(properties, store, transactions);
        failing.initialize(ADMIN);

        // the write is rolled back together with the transaction
        doNothing().when(store).saveFeatures(any());
        failCommit.set(true);

        assertThrows(TransactionSystemException.class,
            () -> failing.execute(state -> state.getFeatureFlags().update(true, true)));

        assertEquals(FeatureState.initial(), failing.requireState().getFeatureFlags().current());
        assertFalse(failing.requireState().lock().isLocked());
    }
}
