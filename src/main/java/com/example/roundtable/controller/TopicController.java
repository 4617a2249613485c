package com.example.roundtable.controller;

import com.example.roundtable.model.Topic;
import com.example.roundtable.topic.TopicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/topics")
public class TopicController {

  private static final Logger log = LoggerFactory.getLogger(TopicController.class);

  /** Upper bound for one generate request; the topic service applies its own, shorter timeout. */
  static final Duration GENERATE_WAIT = Duration.ofSeconds(15);

  private final TopicService topics;

  public TopicController(TopicService topics) {
    this.topics = topics;
  }

  @GetMapping
  public ResponseEntity<Map<String, Object>> all() {
    return ApiEnvelope.ok(topics.fallbackTopics());
  }

  @GetMapping("/generate")
  public ResponseEntity<Map<String, Object>> generate() {
    try {
      Topic t = topics.nextTopic().get(GENERATE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      return ApiEnvelope.ok(t);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, "Interrupted while generating topic");
    } catch (Exception e) {
      log.error("Topic generation endpoint failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to generate topic");
    }
  }

  @GetMapping("/category/{category}")
  public ResponseEntity<Map<String, Object>> byCategory(@PathVariable String category) {
    Optional<Topic> t = topics.byCategory(category);
    if (t.isEmpty()) return ApiEnvelope.error(HttpStatus.NOT_FOUND, "No topics found for this category");
    return ApiEnvelope.ok(t.get());
  }
}
