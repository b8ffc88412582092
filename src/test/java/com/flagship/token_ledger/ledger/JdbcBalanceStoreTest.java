package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the JDBC balance store against a real PostgreSQL.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcBalanceStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("token_ledger_test")
            .withUsername("test")
            .withPassword("test");

    private static JdbcTemplate jdbcTemplate;

    private static final Address HOLDER = Address.of("0xB");
    private static final Address OTHER = Address.of("0xC");

    private JdbcBalanceStore store;

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM holder_balances");
        store = new JdbcBalanceStore(jdbcTemplate);
    }

    @Test
    @DisplayName("Unknown holder has balance zero")
    void testUnknownHolder() {
        assertEquals(0, store.getBalance(HOLDER));
    }

    @Test
    @DisplayName("Credits accumulate on the same row")
    void testCreditsAccumulate() {
        store.credit(HOLDER, 30);
        store.credit(HOLDER, 12);

        assertEquals(42, store.getBalance(HOLDER));
        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM holder_balances WHERE holder = ?", Integer.class, HOLDER.getValue());
        assertEquals(1, rows);
    }

    @Test
    @DisplayName("Debit within balance succeeds")
    void testDebit() {
        store.credit(HOLDER, 30);
        store.debit(HOLDER, 30);

        assertEquals(0, store.getBalance(HOLDER));
    }

    @Test
    @DisplayName("Debit beyond balance fails and leaves the balance unchanged")
    void testDebitUnderflow() {
        store.credit(HOLDER, 5);

        LedgerException e = assertThrows(LedgerException.class, () -> store.debit(HOLDER, 6));
        LedgerException missing = assertThrows(LedgerException.class, () -> store.debit(OTHER, 1));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, e.getCode());
        assertEquals("5", e.getDetails().get("balance"));
        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, missing.getCode());
        assertEquals(5, store.getBalance(HOLDER));
    }

    @Test
    @DisplayName("Staged airdrop-style commit works against the database")
    void testStagedCommit() {
        store.credit(HOLDER, 20);

        StagedBalances staged = new StagedBalances(store);
        staged.debit(HOLDER, 15);
        staged.credit(OTHER, 15);
        staged.commit();

        assertEquals(5, store.getBalance(HOLDER));
        assertEquals(15, store.getBalance(OTHER));
    }
}
