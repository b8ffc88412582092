package com.flagship.token_ledger.health;

import com.flagship.token_ledger.asset.AssetRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The database is checked only when the service runs with a DataSource
 * (i.e. the JDBC balance store).
 */
@RestController
public class HealthController {

    private final AssetRegistry assetRegistry;
    private final ObjectProvider<DataSource> dataSource;

    public HealthController(AssetRegistry assetRegistry, ObjectProvider<DataSource> dataSource) {
        this.assetRegistry = assetRegistry;
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("asset", assetRegistry.isInitialized() ? "INITIALIZED" : "UNINITIALIZED");

        DataSource source = dataSource.getIfAvailable();
        if (source == null) {
            return ResponseEntity.ok(response);
        }

        boolean dbHealthy = checkDatabase(source);
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase(DataSource source) {
        try (Connection connection = source.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
