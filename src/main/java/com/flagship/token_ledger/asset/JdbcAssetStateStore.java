package com.flagship.token_ledger.asset;

import com.flagship.token_ledger.feature.FeatureState;
import com.flagship.token_ledger.ledger.Address;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link AssetStateStore} on the {@code ledger_asset} and {@code whitelist_members} tables.
 *
 * {@code ledger_asset} holds a single row ({@code slot = 1}); the primary key on the slot
 * is what makes initialization once-only across restarts and instances.
 */
public class JdbcAssetStateStore implements AssetStateStore {

    private static final RowMapper<Asset> ASSET_MAPPER = (rs, rowNum) -> new Asset(
        rs.getObject("id", UUID.class),
        rs.getString("symbol"),
        rs.getString("name"),
        rs.getInt("decimals"),
        rs.getLong("max_per_holder"),
        Address.of(rs.getString("admin")),
        rs.getTimestamp("created_at").toInstant()
    );

    private static final RowMapper<FeatureState> FEATURES_MAPPER = (rs, rowNum) -> new FeatureState(
        rs.getBoolean("airdrop_enabled"),
        rs.getBoolean("whitelist_enabled"),
        rs.getBoolean("paused")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcAssetStateStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Asset> findAsset() {
        return jdbcTemplate.query(
            "SELECT id, symbol, name, decimals, max_per_holder, admin, created_at " +
            "FROM ledger_asset WHERE slot = 1",
            ASSET_MAPPER
        ).stream().findFirst();
    }

    @Override
    public boolean insertAsset(Asset asset) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_asset (slot, id, symbol, name, decimals, max_per_holder, admin, created_at) " +
            "VALUES (1, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT (slot) DO NOTHING",
            asset.getId(),
            asset.getSymbol(),
            asset.getName(),
            asset.getDecimals(),
            asset.getMaxPerHolder(),
            asset.getAdmin().getValue(),
            Timestamp.from(asset.getCreatedAt())
        );
        if (inserted == 1) {
            jdbcTemplate.update("DELETE FROM whitelist_members");
        }
        return inserted == 1;
    }

    @Override
    public FeatureState loadFeatures() {
        return jdbcTemplate.query(
            "SELECT airdrop_enabled, whitelist_enabled, paused FROM ledger_asset WHERE slot = 1",
            FEATURES_MAPPER
        ).stream().findFirst().orElseGet(FeatureState::initial);
    }

    @Override
    public void saveFeatures(FeatureState state) {
        jdbcTemplate.update(
            "UPDATE ledger_asset SET airdrop_enabled = ?, whitelist_enabled = ?, paused = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE slot = 1",
            state.isAirdropEnabled(),
            state.isWhitelistEnabled(),
            state.isPaused()
        );
    }

    @Override
    public List<Address> loadWhitelist() {
        return jdbcTemplate.queryForList(
            "SELECT address FROM whitelist_members ORDER BY position",
            String.class
        ).stream().map(Address::of).toList();
    }

    @Override
    public void addMembers(List<Address> addresses) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO whitelist_members (address) VALUES (?)",
            addresses,
            addresses.size(),
            (ps, address) -> ps.setString(1, address.getValue())
        );
    }

    @Override
    public void removeMembers(List<Address> addresses) {
        jdbcTemplate.batchUpdate(
            "DELETE FROM whitelist_members WHERE address = ?",
            addresses,
            addresses.size(),
            (ps, address) -> ps.setString(1, address.getValue())
        );
    }
}
