package com.flamingo.ai.problemscan.api.rest;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the service liveness check. */
@RestController
@RequestMapping("/health")
public class HealthController {

  private final String applicationName;

  public HealthController(@Value("${spring.application.name:problemscan}") String applicationName) {
    this.applicationName = applicationName;
  }

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", applicationName);
    return ResponseEntity.ok(health);
  }
}
