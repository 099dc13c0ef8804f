package com.flamingo.ai.digest.api.rest;

import com.flamingo.ai.digest.service.enrichment.EnrichmentWorkerPool;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  private final DataSource dataSource;
  private final EnrichmentWorkerPool workerPool;
  private final Clock clock;

  /** Reports database reachability and worker pool state. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean databaseUp = isDatabaseUp();
    Map<String, Object> health = new HashMap<>();
    health.put("status", databaseUp ? "UP" : "DOWN");
    health.put("database", databaseUp ? "UP" : "DOWN");
    health.put("workersRunning", workerPool.isRunning());
    health.put("activeWorkers", workerPool.getActiveWorkers());
    health.put("timestamp", clock.instant());
    health.put("service", "digest-pipeline");
    HttpStatus status = databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(health);
  }

  private boolean isDatabaseUp() {
    try (Connection connection = dataSource.getConnection()) {
      return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      log.warn("Database health check failed: {}", e.getMessage());
      return false;
    }
  }
}
