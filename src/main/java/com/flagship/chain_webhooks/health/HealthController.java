package com.flagship.chain_webhooks.health;

import com.flagship.chain_webhooks.event.EventQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness endpoint for the webhook provider and load
 * balancers. Reports database reachability and the queue fill level.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final EventQueue eventQueue;

    public HealthController(DataSource dataSource, EventQueue eventQueue) {
        this.dataSource = dataSource;
        this.eventQueue = eventQueue;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("queueDepth", eventQueue.size());
        response.put("queueCapacity", eventQueue.capacity());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
