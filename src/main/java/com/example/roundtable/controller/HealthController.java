package com.example.roundtable.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  static final String SERVICE_NAME = "roundtable";

  /** Fast liveness check, touches nothing. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "OK");
    m.put("timestamp", Instant.now().toString());
    m.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0);
    return m;
  }

  @GetMapping("/api/health")
  public Map<String, Object> apiHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "OK");
    m.put("timestamp", Instant.now().toString());
    m.put("service", SERVICE_NAME);
    return m;
  }
}
