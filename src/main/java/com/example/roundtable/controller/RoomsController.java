package com.example.roundtable.controller;

import com.example.roundtable.service.RoundtableEventLoop;
import com.example.roundtable.service.RoundtableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/** Read-only view of the live rooms. Every read is answered by the roundtable loop. */
@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private static final Logger log = LoggerFactory.getLogger(RoomsController.class);

  static final Duration READ_TIMEOUT = Duration.ofSeconds(2);

  private final RoundtableService service;
  private final RoundtableEventLoop loop;

  public RoomsController(RoundtableService service, RoundtableEventLoop loop) {
    this.service = service;
    this.loop = loop;
  }

  @GetMapping
  public ResponseEntity<Map<String, Object>> list() {
    try {
      return ApiEnvelope.ok(loop.call(service::roomSummaries, READ_TIMEOUT));
    } catch (Exception e) {
      log.error("Listing rooms failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }

  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    try {
      return ApiEnvelope.ok(loop.call(service::roomStats, READ_TIMEOUT));
    } catch (Exception e) {
      log.error("Room stats failed", e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }

  @GetMapping("/{roomId}")
  public ResponseEntity<Map<String, Object>> get(@PathVariable String roomId) {
    try {
      Optional<Map<String, Object>> state = loop.call(() -> service.discussionState(roomId), READ_TIMEOUT);
      if (state.isEmpty()) return ApiEnvelope.error(HttpStatus.NOT_FOUND, "Room not found");
      return ApiEnvelope.ok(state.get());
    } catch (Exception e) {
      log.error("Reading room {} failed", roomId, e);
      return ApiEnvelope.error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }
}
