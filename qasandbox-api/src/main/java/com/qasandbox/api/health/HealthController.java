package com.qasandbox.api.health;

import com.qasandbox.api.docs.ApiInfoProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness and discovery endpoints.
 * Deep checks (database) live under /actuator/health.
 */
@RestController
public class HealthController {

  static final String HEALTH_PATH = "/health";

  private final ApiInfoProperties info;

  public HealthController(ApiInfoProperties info) {
    this.info = info;
  }

  @GetMapping({HEALTH_PATH, "/api/v1/health"})
  public Map<String, String> health() {
    return Map.of("status", "healthy");
  }

  /** Entry point for testers: where the docs and the health check are. */
  @GetMapping("/")
  public Map<String, String> root() {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("name", info.name());
    body.put("version", info.version());
    body.put("docs", info.docsPath());
    body.put("health", HEALTH_PATH);
    return body;
  }
}
