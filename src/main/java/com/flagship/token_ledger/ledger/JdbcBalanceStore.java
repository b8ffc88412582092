package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * {@link BalanceStore} on the {@code holder_balances} table.
 *
 * The table carries a {@code CHECK (balance >= 0)} constraint; the conditional update in
 * {@link #debit} keeps us from ever hitting it.
 */
public class JdbcBalanceStore implements BalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long getBalance(Address holder) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT balance FROM holder_balances WHERE holder = ?",
            Long.class,
            holder.getValue()
        );
        return rows.isEmpty() ? 0L : rows.get(0);
    }

    @Override
    public void credit(Address holder, long amount) {
        jdbcTemplate.update(
            "INSERT INTO holder_balances (holder, balance, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (holder) DO UPDATE SET balance = holder_balances.balance + EXCLUDED.balance, " +
            "updated_at = CURRENT_TIMESTAMP",
            holder.getValue(),
            amount
        );
    }

    @Override
    public void debit(Address holder, long amount) {
        int updated = jdbcTemplate.update(
            "UPDATE holder_balances SET balance = balance - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE holder = ? AND balance >= ?",
            amount,
            holder.getValue(),
            amount
        );
        if (updated == 0) {
            throw LedgerException.insufficientBalance(holder, getBalance(holder), amount);
        }
    }
}
