package com.flagship.mpesa_bridge.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness check. Reports "healthy" while the transaction store is reachable.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final Clock clock;

    public HealthController(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbHealthy = checkDatabase();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", dbHealthy ? "healthy" : "unhealthy");
        response.put("timestamp", clock.instant().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");

        return dbHealthy ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return false;
        }
    }
}
