package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.asset.AssetStateStore;
import com.flagship.token_ledger.asset.InMemoryAssetStateStore;
import com.flagship.token_ledger.asset.JdbcAssetStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Selects where balances and asset state live.
 *
 * {@code ledger.balance-store=jdbc} (default) keeps both in PostgreSQL;
 * {@code ledger.balance-store=memory} keeps them on the heap.
 */
@Configuration
@Slf4j
public class LedgerStorageConfig {

    @Configuration
    @ConditionalOnProperty(name = "ledger.balance-store", havingValue = "jdbc", matchIfMissing = true)
    static class Jdbc {

        @Bean
        public BalanceStore jdbcBalanceStore(JdbcTemplate jdbcTemplate) {
            log.info("Using JDBC balance store");
            return new JdbcBalanceStore(jdbcTemplate);
        }

        @Bean
        public AssetStateStore jdbcAssetStateStore(JdbcTemplate jdbcTemplate) {
            return new JdbcAssetStateStore(jdbcTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ledger.balance-store", havingValue = "memory")
    static class Memory {

        @Bean
        public BalanceStore inMemoryBalanceStore() {
            log.info("Using in-memory stores; balances and asset state will not survive a restart");
            return new InMemoryBalanceStore();
        }

        @Bean
        public AssetStateStore inMemoryAssetStateStore() {
            return new InMemoryAssetStateStore();
        }
    }
}
