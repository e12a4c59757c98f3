package com.flagship.expense_ledger.health;

import com.flagship.expense_ledger.reconciliation.InProcessChangeFeed;
import lombok.extern.slf4j.Slf4j;
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
 * Liveness/readiness probe that needs no actuator access.
 *
 * Only the database decides the status; a stopped change feed is reported but leaves the
 * service able to take writes.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final InProcessChangeFeed changeFeed;

    public HealthController(DataSource dataSource, InProcessChangeFeed changeFeed) {
        this.dataSource = dataSource;
        this.changeFeed = changeFeed;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("change_feed", changeFeed.isAvailable() ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
