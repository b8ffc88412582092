package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.LedgerFixture;
import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;
import com.flagship.token_ledger.ledger.JdbcBalanceStore;
import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static com.flagship.token_ledger.LedgerFixture.ADMIN;
import static com.flagship.token_ledger.LedgerFixture.B;
import static com.flagship.token_ledger.LedgerFixture.C;
import static com.flagship.token_ledger.LedgerFixture.STRANGER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs asset state and the ledger services against a real PostgreSQL, each test
 * "restarting" by building a second registry over the same database.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcAssetStateStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("token_ledger_test")
            .withUsername("test")
            .withPassword("test");

    private static JdbcTemplate jdbcTemplate;
    private static TransactionTemplate transactionTemplate;

    private final AssetProperties properties = new AssetProperties();

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM whitelist_members");
        jdbcTemplate.update("DELETE FROM ledger_asset");
        jdbcTemplate.update("DELETE FROM holder_balances");
    }

    private LedgerFixture start() {
        AssetRegistry registry = new AssetRegistry(properties, new JdbcAssetStateStore(jdbcTemplate), transactionTemplate);
        return new LedgerFixture(new JdbcBalanceStore(jdbcTemplate), registry);
    }

    @Test
    @DisplayName("Asset, switches, whitelist and balances survive a restart")
    void testRestart() {
        printTestHeader("Restart Keeps Asset State");

        LedgerFixture first = start().initialized();
        Asset asset = first.assetRegistry.getMetadata();
        first.ledgerService.mint(ADMIN, ADMIN, 60);
        first.readyForAirdrop(C, B);
        first.whitelistService.updateWhitelist(ADMIN, List.of(C), false);

        LedgerFixture restarted = start();

        assertEquals(asset, restarted.assetRegistry.getMetadata());
        assertEquals(new FeatureState(true, true, false),
            restarted.featureService.getFeatures(ADMIN));
        assertEquals(List.of(B), restarted.whitelistService.listMembers(ADMIN));
        assertEquals(60, restarted.balance(ADMIN));

        restarted.airdropService.airdrop(ADMIN, List.of(B), List.of(10L));
        assertEquals(10, restarted.balance(B));
    }

    @Test
    @DisplayName("Initialize after a restart is rejected and the first admin stays in charge")
    void testInitializeOnce() {
        LedgerFixture first = start().initialized();
        Asset asset = first.assetRegistry.getMetadata();

        LedgerFixture restarted = start();
        LedgerException e = assertThrows(LedgerException.class,
            () -> restarted.assetRegistry.initialize(STRANGER));

        assertEquals(LedgerErrorCode.ALREADY_INITIALIZED, e.getCode());
        assertEquals(asset.getId().toString(), e.getDetails().get("assetId"));
        assertEquals(ADMIN, restarted.assetRegistry.getMetadata().getAdmin());
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_asset", Integer.class);
        assertEquals(1, rows);
    }

    @Test
    @DisplayName("Second insert on the asset slot is refused by the database")
    void testInsertAssetOnce() {
        JdbcAssetStateStore store = new JdbcAssetStateStore(jdbcTemplate);
        Asset first = start().initialized().assetRegistry.getMetadata();
        Asset second = new Asset(UUID.randomUUID(), "CAP", "Capped Token", 0, 100, B,
            first.getCreatedAt());

        assertFalse(store.insertAsset(second));
        assertEquals(first, store.findAsset().orElseThrow());
    }

    @Test
    @DisplayName("Concurrent mint, transfer, airdrop and burn keep cap and conservation in the database")
    void testConcurrentOperations() throws InterruptedException {
        printTestHeader("Concurrent Operations on PostgreSQL");

        LedgerFixture fixture = start().initialized();
        fixture.ledgerService.mint(ADMIN, ADMIN, 100);
        fixture.readyForAirdrop(B, C);

        LedgerFixture.ConcurrentLoad load = fixture.runConcurrentLoad(4, 25);
        printOutput("Minted", load.getMinted());
        printOutput("Burned", load.getBurned());
        printOutput("Rejected operations", load.getRejected());

        assertTrue(load.getUnexpected().isEmpty(), "unexpected failures: " + load.getUnexpected());
        long total = 0;
        for (Address holder : List.of(ADMIN, B, C)) {
            long balance = fixture.balance(holder);
            assertTrue(balance >= 0 && balance <= 100, "balance out of range for " + holder + ": " + balance);
            total += balance;
        }
        assertEquals(100 + load.getMinted() - load.getBurned(), total);
        Long stored = jdbcTemplate.queryForObject("SELECT COALESCE(SUM(balance), 0) FROM holder_balances", Long.class);
        assertEquals(total, stored);
    }
}
