package com.flagship.fx_payments.health;

import com.flagship.fx_payments.fx.QuoteCache;
import com.flagship.fx_payments.fx.RateSource;
import com.flagship.fx_payments.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
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
 * Lightweight status page for load balancers. The actuator endpoints carry the detail.
 *
 * Reports DOWN only when the database is unreachable; a cold rate cache or an
 * outbox backlog is informational.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final RateSource activeSource;
    private final QuoteCache quoteCache;
    private final OutboxService outboxService;

    public HealthController(DataSource dataSource,
                            @Qualifier("activeRateSource") RateSource activeSource,
                            QuoteCache quoteCache,
                            OutboxService outboxService) {
        this.dataSource = dataSource;
        this.activeSource = activeSource;
        this.quoteCache = quoteCache;
        this.outboxService = outboxService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("checked_at", Instant.now().toString());
        body.put("rate_source", activeSource.type().name());
        body.put("cached_pairs", quoteCache.size());

        if (!databaseReachable()) {
            body.put("database", "DOWN");
            body.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("database", "UP");
        body.put("outbox_backlog", outboxService.countUnpublished());
        body.put("status", "UP");
        return ResponseEntity.ok(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
