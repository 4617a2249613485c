package com.example.roundtable.handler;

import com.example.roundtable.model.ErrorCode;
import com.example.roundtable.model.RoundtableException;
import com.example.roundtable.service.RoomBroadcaster;
import com.example.roundtable.service.RoundtableEventLoop;
import com.example.roundtable.service.RoundtableService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * WebSocket handler for /roundtable.
 * - Handshake: userId (identity) and displayName/anonymousName from the query string
 * - Inbound JSON frames with a "type"; legacy event names are accepted as aliases
 * - Heartbeat: plain "ping" or {type:ping} is answered with a pong frame
 * - Every event is queued on the roundtable loop; rejections go back to the sender only,
 *   unexpected failures close the socket with SERVER_ERROR
 */
@Component
public class RoundtableWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RoundtableWebSocketHandler.class);

    static final String JOIN_ERROR = "join-error";
    static final String ROLE_ERROR = "role-error";
    static final String ERROR = "error";

    private final RoundtableService service;
    private final RoomBroadcaster broadcaster;
    private final RoundtableEventLoop loop;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RoundtableWebSocketHandler(RoundtableService service,
                                      RoomBroadcaster broadcaster,
                                      RoundtableEventLoop loop) {
        this.service = service;
        this.broadcaster = broadcaster;
        this.loop = loop;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        try {
            Map<String, String> q = parseQuery(session.getUri());
            final String userId = q.get("userId");
            final String displayName = q.containsKey("displayName") ? q.get("displayName") : q.get("anonymousName");

            log.info("WS OPEN sid={} userId={} name={}", session.getId(), userId, displayName);
            loop.execute(() -> service.connect(session, userId, displayName));
        } catch (Throwable t) {
            log.error("WS afterConnectionEstablished failed (sid={}, uri={})", session.getId(), safeUri(session), t);
            try { session.close(CloseStatus.SERVER_ERROR); } catch (Exception ignore) {}
            throw t;
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        final String sid = session.getId();
        final String payload = message.getPayload();

        if ("ping".equals(payload)) {
            loop.execute(() -> service.ping(sid));
            return;
        }

        JsonNode frame;
        try {
            frame = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("WS malformed frame sid={}: {}", sid, e.getOriginalMessage());
            loop.execute(() -> broadcaster.error(sid, ERROR, ErrorCode.INVALID_EVENT, "Malformed JSON frame"));
            return;
        }
        if (frame == null || !frame.isObject() || text(frame, "type") == null) {
            loop.execute(() -> broadcaster.error(sid, ERROR, ErrorCode.INVALID_EVENT, "Frame needs a 'type'"));
            return;
        }

        final String type = text(frame, "type").trim().toLowerCase(Locale.ROOT);
        loop.execute(() -> dispatch(session, type, frame));
    }

    /**
     * Runs on the loop. Rejections are answered to the sender; nothing is broadcast.
     * Any other failure closes the socket with SERVER_ERROR.
     */
    void dispatch(WebSocketSession session, String type, JsonNode frame) {
        final String sid = session.getId();
        String replyType = ERROR;
        try {
            switch (type) {
                case "ping":
                    service.ping(sid);
                    break;
                case "join":
                case "join-room":
                    replyType = JOIN_ERROR;
                    service.join(sid,
                            first(frame, "roomId", "room"),
                            first(frame, "displayName", "anonymousName"),
                            text(frame, "role"));
                    break;
                case "set-ready":
                case "user-ready":
                    service.setReady(sid, !frame.has("ready") || frame.get("ready").asBoolean(true));
                    break;
                case "advance-turn":
                case "next-speaker":
                    service.advanceTurn(sid);
                    break;
                case "change-role":
                    replyType = ROLE_ERROR;
                    service.changeRole(sid, first(frame, "identity", "userId"), first(frame, "role", "newRole"));
                    break;
                case "signal":
                    service.signal(sid, text(frame, "kind"), destination(frame), payload(frame));
                    break;
                case "offer":
                case "answer":
                case "ice-candidate":
                    service.signal(sid, type, destination(frame), payload(frame));
                    break;
                case "leave":
                case "leave-room":
                    service.leave(sid);
                    break;
                case "request-sync":
                    service.requestSync(sid);
                    break;
                default:
                    throw new RoundtableException(ErrorCode.INVALID_EVENT, "Unknown event type '" + type + "'");
            }
        } catch (RoundtableException e) {
            log.debug("WS rejected {} from sid={}: {} {}", type, sid, e.getCode(), e.getMessage());
            broadcaster.error(sid, replyType, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("WS {} failed (sid={}), closing", type, sid, e);
            try {
                session.close(CloseStatus.SERVER_ERROR);
            } catch (IOException closeFailure) {
                log.warn("WS close failed (sid={}): {}", sid, closeFailure.toString());
            }
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        final String sid = session.getId();
        log.info("WS CLOSE sid={} code={} reason={}", sid, status.getCode(), status.getReason());
        loop.execute(() -> service.disconnect(sid));
    }

    /* ---------------- helpers ---------------- */

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private static String destination(JsonNode frame) {
        return first(frame, "to", "target");
    }

    /** Opaque payload, handed on as a Jackson tree. */
    private static Object payload(JsonNode frame) {
        if (frame.has("payload")) return frame.get("payload");
        if (frame.has("data")) return frame.get("data");
        return null;
    }

    private static String first(JsonNode frame, String name, String alias) {
        String v = text(frame, name);
        return v != null ? v : text(frame, alias);
    }

    private static String text(JsonNode frame, String field) {
        JsonNode n = frame.get(field);
        if (n == null || n.isNull() || n.isContainerNode()) return null;
        return n.asText();
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }
}
