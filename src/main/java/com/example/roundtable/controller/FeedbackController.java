package com.example.roundtable.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {

  private static final Logger log = LoggerFactory.getLogger(FeedbackController.class);

  static final int LOGGED_COMMENT_LENGTH = 100;

  @PostMapping
  public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody FeedbackRequest body, BindingResult errors) {
    if (errors.hasErrors()) {
      return ApiEnvelope.error(HttpStatus.BAD_REQUEST, "Rating must be between 1 and 5");
    }
    String comment = body.comment == null ? "" : body.comment;
    if (comment.length() > LOGGED_COMMENT_LENGTH) comment = comment.substring(0, LOGGED_COMMENT_LENGTH);
    log.info("Feedback received: rating={}, sessionId={}, comment='{}'", body.rating, body.sessionId, comment);

    Map<String, Object> m = new LinkedHashMap<>();
    m.put("success", true);
    m.put("message", "Feedback received successfully");
    return ResponseEntity.ok(m);
  }

  /** POST body */
  public static final class FeedbackRequest {
    @NotNull @Min(1) @Max(5)
    public Integer rating;
    @Size(max = 2000)
    public String comment;
    @Size(max = 64)
    public String sessionId;
  }
}
