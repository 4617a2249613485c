package com.example.roundtable.service;

import com.example.roundtable.model.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound side of the gateway: connected transports by id and the JSON frames sent to them.
 * Room fan-out goes to the transports currently listed in the room's roster.
 */
@Component
public class RoomBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /** transport id -> open session */
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    // ========================================================================
    //  TRANSPORTS
    // ========================================================================

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
    }

    public void unregister(String transportId) {
        if (transportId != null) sessions.remove(transportId);
    }

    public boolean isConnected(String transportId) {
        if (transportId == null) return false;
        WebSocketSession s = sessions.get(transportId);
        return s != null && s.isOpen();
    }

    public int connectedCount() {
        return sessions.size();
    }

    // ========================================================================
    //  ROOM EVENTS
    // ========================================================================

    public void rosterChanged(Room room) {
        Map<String, Object> payload = frame("roster-changed");
        payload.put("roomId", room.getCode());
        payload.put("participants", rosterView(room));
        broadcast(room, payload);
    }

    public void participantLeft(Room room, String identity) {
        Map<String, Object> payload = frame("participant-left");
        payload.put("identity", identity);
        payload.put("participants", rosterView(room));
        broadcast(room, payload);
    }

    public void roleChanged(Room room, Participant changed) {
        Map<String, Object> payload = frame("role-changed");
        payload.put("identity", changed.getIdentity());
        payload.put("role", changed.getRole().wireName());
        payload.put("participants", rosterView(room));
        broadcast(room, payload);
    }

    public void discussionStarted(Room room) {
        Discussion d = room.getDiscussion();
        Map<String, Object> payload = frame("discussion-started");
        payload.put("topic", topicView(d.getTopic()));
        payload.put("firstSpeaker", room.currentSpeaker().map(RoomBroadcaster::participantView).orElse(null));
        payload.put("duration", d.getTurnDurationSeconds());
        payload.put("round", d.getRound());
        broadcast(room, payload);
    }

    public void speakerChanged(Room room) {
        Discussion d = room.getDiscussion();
        Map<String, Object> payload = frame("speaker-changed");
        payload.put("speaker", room.currentSpeaker().map(RoomBroadcaster::participantView).orElse(null));
        payload.put("timeRemaining", d.getTimeRemaining());
        payload.put("round", d.getRound());
        broadcast(room, payload);
    }

    public void tick(Room room) {
        Map<String, Object> payload = frame("tick");
        payload.put("timeRemaining", room.getDiscussion().getTimeRemaining());
        broadcast(room, payload);
    }

    public void discussionEnded(Room room, String reason) {
        Discussion d = room.getDiscussion();
        Map<String, Object> payload = frame("discussion-ended");
        payload.put("reason", reason);
        payload.put("roundsCompleted", Math.max(0, d.getRound() - 1));
        broadcast(room, payload);
    }

    // ========================================================================
    //  TARGETED
    // ========================================================================

    public void identity(String transportId, SessionContext ctx) {
        Map<String, Object> payload = frame("you");
        payload.put("identity", ctx.identity());
        payload.put("displayName", ctx.displayName());
        payload.put("transportId", ctx.transportId());
        sendTo(transportId, payload);
    }

    public void rosterTo(String transportId, Room room) {
        Map<String, Object> payload = frame("roster-changed");
        payload.put("roomId", room.getCode());
        payload.put("participants", rosterView(room));
        sendTo(transportId, payload);
    }

    public void discussionStateTo(String transportId, Room room) {
        Map<String, Object> payload = frame("discussion-state");
        payload.putAll(discussionState(room));
        sendTo(transportId, payload);
    }

    public void error(String transportId, String type, ErrorCode code, String message) {
        Map<String, Object> payload = frame(type);
        payload.put("code", code.name());
        payload.put("message", message);
        sendTo(transportId, payload);
    }

    public void pong(String transportId) {
        sendTo(transportId, frame("pong"));
    }

    /** Low-level targeted send. Returns false when the transport is gone or the write failed. */
    public boolean sendTo(String transportId, Map<String, Object> payload) {
        WebSocketSession session = transportId == null ? null : sessions.get(transportId);
        if (session == null) return false;
        if (!session.isOpen()) {
            sessions.remove(transportId);
            return false;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
            return true;
        } catch (JsonProcessingException e) {
            log.error("Cannot encode {} frame", payload.get("type"), e);
            return false;
        } catch (IOException | RuntimeException e) {
            log.warn("Send to {} failed, dropping transport: {}", transportId, e.toString());
            sessions.remove(transportId);
            return false;
        }
    }

    /** Low-level room fan-out to every roster transport. */
    public void broadcast(Room room, Map<String, Object> payload) {
        for (Participant p : room.getParticipants()) {
            sendTo(p.getTransportId(), payload);
        }
    }

    // ========================================================================
    //  VIEWS
    // ========================================================================

    public static Map<String, Object> discussionState(Room room) {
        Discussion d = room.getDiscussion();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("roomId", room.getCode());
        out.put("status", d.getStatus().name().toLowerCase(Locale.ROOT));
        out.put("active", d.isActive());
        out.put("topic", topicView(d.getTopic()));
        out.put("currentSpeaker", room.currentSpeaker().map(RoomBroadcaster::participantView).orElse(null));
        out.put("timeRemaining", d.getTimeRemaining());
        out.put("round", d.getRound());
        out.put("turnDuration", d.getTurnDurationSeconds());
        out.put("participantCount", room.size());
        return out;
    }

    public static List<Map<String, Object>> rosterView(Room room) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Participant p : room.getParticipants()) out.add(participantView(p));
        return out;
    }

    public static Map<String, Object> participantView(Participant p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", p.getIdentity());
        m.put("displayName", p.getDisplayName());
        m.put("role", p.getRole().wireName());
        m.put("isReady", p.isReady());
        m.put("joinedAt", p.getJoinedAt() == null ? null : p.getJoinedAt().toString());
        m.put("transportId", p.getTransportId());
        return m;
    }

    public static Map<String, Object> topicView(Topic t) {
        if (t == null) return null;
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("title", t.title());
        m.put("description", t.description());
        m.put("category", t.category());
        m.put("questions", t.questions());
        m.put("source", t.source());
        return m;
    }

    private static Map<String, Object> frame(String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        return payload;
    }
}
