package com.example.roundtable.controller;

import com.example.roundtable.analytics.SessionAnalytics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

  static final int MAX_LIMIT = 100;

  private final SessionAnalytics analytics;

  public AnalyticsController(SessionAnalytics analytics) {
    this.analytics = analytics;
  }

  @GetMapping("/sessions")
  public ResponseEntity<Map<String, Object>> sessions(@RequestParam(name = "limit", defaultValue = "10") int limit) {
    try {
      int bounded = Math.max(1, Math.min(MAX_LIMIT, limit));
      return ApiEnvelope.ok(analytics.recentSessions(bounded));
    } catch (Exception e) {
      log.error("Fetching sessions failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch sessions");
    }
  }

  @GetMapping("/topics")
  public ResponseEntity<Map<String, Object>> topics() {
    try {
      return ApiEnvelope.ok(analytics.topicUsage());
    } catch (Exception e) {
      log.error("Fetching topic usage failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch topics");
    }
  }

  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    try {
      return ApiEnvelope.ok(analytics.stats());
    } catch (Exception e) {
      log.error("Fetching stats failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch statistics");
    }
  }
}
