package com.example.roundtable.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** {success, data[, count]} / {success:false, error} bodies shared by the JSON endpoints. */
final class ApiEnvelope {

  private ApiEnvelope() {}

  static ResponseEntity<Map<String, Object>> ok(Object data) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("success", true);
    m.put("data", data);
    if (data instanceof Collection<?> c) m.put("count", c.size());
    return ResponseEntity.ok(m);
  }

  static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("success", false);
    m.put("error", message);
    return ResponseEntity.status(status).body(m);
  }
}
