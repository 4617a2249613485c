package com.example.roundtable.config;

import com.example.roundtable.handler.RoundtableWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.*;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final RoundtableWebSocketHandler handler;
  private final String wsPath;
  private final List<String> originPatterns;

  public WebSocketConfig(
      RoundtableWebSocketHandler handler,
      @Value("${app.websocket.path:/roundtable}") String wsPath,
      // CSV of client origins
      @Value("${app.websocket.allowed-origins:http://localhost:5173,http://localhost:5174}") String originsCsv,
      // allow any origin while troubleshooting
      @Value("${app.websocket.debug-open:false}") boolean debugOpen
  ) {
    this.handler = handler;
    this.wsPath = wsPath;
    this.originPatterns = debugOpen ? List.of("*") : toOriginPatterns(originsCsv);
  }

  /**
   * Turns the configured origins into patterns. Local dev origins match any port on localhost and 127.0.0.1.
   * An empty list means "*".
   */
  static List<String> toOriginPatterns(String originsCsv) {
    Set<String> out = new LinkedHashSet<>();
    for (String raw : (originsCsv == null ? "" : originsCsv).split(",")) {
      String origin = raw.trim();
      if (origin.isEmpty()) continue;
      out.add(origin);
      if (origin.startsWith("http://localhost") || origin.startsWith("http://127.0.0.1")) {
        out.add("http://localhost:*");
        out.add("http://127.0.0.1:*");
      } else if (origin.startsWith("https://localhost")) {
        out.add("https://localhost:*");
      }
    }
    return out.isEmpty() ? List.of("*") : new ArrayList<>(out);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    log.info("Roundtable socket at {} (origins={})", wsPath, originPatterns);
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }

  /** SDP offers exceed the container's 8 KiB default. */
  @Bean
  public ServletServerContainerFactoryBean createWebSocketContainer(
      @Value("${app.websocket.max-text-message-bytes:65536}") int maxTextBytes,
      @Value("${app.websocket.idle-timeout-ms:120000}") long idleTimeoutMs) {
    ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
    container.setMaxTextMessageBufferSize(maxTextBytes);
    container.setMaxSessionIdleTimeout(idleTimeoutMs);
    return container;
  }
}
