package com.example.roundtable.service;

import com.example.roundtable.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gateway logic behind the WebSocket handler: resolves the sender's session context, mutates the roster,
 * lets the engine re-evaluate and fans out the result. Runs on the roundtable loop.
 * Rejections surface as {@link RoundtableException}; the caller turns them into a reply to the sender.
 */
@Service
public class RoundtableService {

    private static final Logger log = LoggerFactory.getLogger(RoundtableService.class);

    public static final String DEFAULT_ROOM = "general";
    static final int MAX_ROOM_ID_LENGTH = 100;
    static final int MAX_DISPLAY_NAME_LENGTH = 80;

    private final RoomRegistry registry;
    private final DiscussionEngine engine;
    private final RoomBroadcaster broadcaster;
    private final SignalRelay relay;

    /** transport id -> session context */
    private final Map<String, SessionContext> contexts = new ConcurrentHashMap<>();

    public RoundtableService(RoomRegistry registry,
                             DiscussionEngine engine,
                             RoomBroadcaster broadcaster,
                             SignalRelay relay) {
        this.registry = registry;
        this.engine = engine;
        this.broadcaster = broadcaster;
        this.relay = relay;
    }

    // ========================================================================
    //  CONNECTION
    // ========================================================================

    /** Registers a freshly opened transport with its handshake identity. */
    public SessionContext connect(WebSocketSession session,
                                  String claimedIdentity, String displayName) {
        String transportId = session.getId();
        String identity = (claimedIdentity == null || claimedIdentity.isBlank()) ? transportId : claimedIdentity.trim();
        SessionContext ctx = new SessionContext(transportId, identity, normalizeDisplayName(displayName), null);
        broadcaster.register(session);
        contexts.put(transportId, ctx);
        log.info("Transport connected: transport={}, identity={}, name='{}'", transportId, identity, ctx.displayName());
        return ctx;
    }

    /** Transport loss: implicit leave of the last room, then forget the transport. */
    public void disconnect(String transportId) {
        SessionContext ctx = contexts.remove(transportId);
        broadcaster.unregister(transportId);
        if (ctx == null) return;
        if (ctx.inRoom()) leaveCurrentRoom(ctx, "disconnect");
        log.info("Transport disconnected: transport={}, identity={}", transportId, ctx.identity());
    }

    public Optional<SessionContext> context(String transportId) {
        return Optional.ofNullable(contexts.get(transportId));
    }

    public void ping(String transportId) {
        broadcaster.pong(transportId);
    }

    // ========================================================================
    //  ROOM MEMBERSHIP
    // ========================================================================

    /**
     * Joins (or rejoins) a room. A transport belongs to one room at a time, so joining another room leaves
     * the previous one first. Rejoining with the same identity replaces the roster entry in place.
     *
     * @throws RoundtableException INVALID_ROLE or ROOM_LIMIT
     */
    public Room join(String transportId, String rawRoomId, String displayName, String rawRole) {
        SessionContext ctx = requireContext(transportId);
        String roomId = normalizeRoomId(rawRoomId);

        Role requested = null;
        if (rawRole != null && !rawRole.isBlank()) {
            requested = Role.parse(rawRole).orElseThrow(() ->
                    new RoundtableException(ErrorCode.INVALID_ROLE, "Unknown role '" + rawRole + "'"));
        }

        if (displayName != null && !displayName.isBlank()) {
            ctx = new SessionContext(ctx.transportId(), ctx.identity(), normalizeDisplayName(displayName), ctx.roomId());
            contexts.put(transportId, ctx);
        }
        // resolve the target first: a rejected join leaves the caller where they were
        Room room = registry.getOrCreate(roomId);
        if (ctx.inRoom() && !ctx.roomId().equals(roomId)) {
            leaveCurrentRoom(ctx, "switched-room");
            ctx = ctx.withoutRoom();
        }

        Participant existing = room.find(ctx.identity()).orElse(null);
        Role role = requested != null ? requested : (existing != null ? existing.getRole() : Role.LISTENER);

        Participant incoming = new Participant(ctx.identity(), transportId, ctx.displayName());
        incoming.setRole(role);
        incoming.setJoinedAt(Instant.now());
        room.add(incoming);

        if (role == Role.SPEAKER && incoming.getRole() != Role.SPEAKER) {
            log.info("Speaker slots full in room {} ({}), {} admitted as listener",
                    room.getCode(), room.getMaxSpeakers(), ctx.identity());
        }
        if (existing != null) detachStaleTransport(room, ctx.identity(), transportId);

        ctx = ctx.withRoom(room.getCode());
        contexts.put(transportId, ctx);
        log.info("{} {} room {} (participants={})",
                ctx.identity(), existing != null ? "rejoined" : "joined", room.getCode(), room.size());

        broadcaster.identity(transportId, ctx);
        broadcaster.rosterChanged(room);
        broadcaster.discussionStateTo(transportId, room);
        engine.evaluateStart(room);
        return room;
    }

    /** Explicit departure. Leaving without a room is a no-op. */
    public void leave(String transportId) {
        SessionContext ctx = requireContext(transportId);
        if (!ctx.inRoom()) {
            log.debug("Leave ignored, transport {} is not in a room", transportId);
            return;
        }
        leaveCurrentRoom(ctx, "leave");
    }

    public Participant setReady(String transportId, boolean ready) {
        SessionContext ctx = requireContext(transportId);
        Room room = requireRoom(ctx);
        Participant p = room.setReady(ctx.identity(), ready);
        log.info("{} in room {} is {}", ctx.identity(), room.getCode(), ready ? "ready" : "not ready");

        broadcaster.rosterChanged(room);
        engine.evaluateStart(room);
        return p;
    }

    /**
     * @throws RoundtableException NOT_IN_ROOM, NOT_ACTIVE or NOT_CURRENT_SPEAKER
     */
    public void advanceTurn(String transportId) {
        SessionContext ctx = requireContext(transportId);
        Room room = requireRoom(ctx);
        Participant actor = room.find(ctx.identity()).orElse(null);
        engine.advanceTurn(room, actor);
    }

    /**
     * Changes the role of {@code targetIdentity} (the sender itself when blank).
     *
     * @throws RoundtableException NOT_IN_ROOM, INVALID_ROLE or CAPACITY_EXCEEDED
     */
    public Participant changeRole(String transportId, String targetIdentity, String rawRole) {
        SessionContext ctx = requireContext(transportId);
        Room room = requireRoom(ctx);
        Role role = Role.parse(rawRole).orElseThrow(() ->
                new RoundtableException(ErrorCode.INVALID_ROLE, "Role must be 'speaker' or 'listener'"));
        String target = (targetIdentity == null || targetIdentity.isBlank()) ? ctx.identity() : targetIdentity;

        Participant changed = room.updateRole(target, role);
        log.info("Role of {} in room {} set to {}", target, room.getCode(), role.wireName());
        broadcaster.roleChanged(room, changed);
        return changed;
    }

    /**
     * Forwards a signaling payload. No room is required and nothing is replied on a missing destination.
     *
     * @throws RoundtableException INVALID_EVENT for an unknown kind
     */
    public boolean signal(String transportId, String rawKind, String destinationTransportId, Object payload) {
        requireContext(transportId);
        SignalKind kind = SignalKind.parse(rawKind).orElseThrow(() ->
                new RoundtableException(ErrorCode.INVALID_EVENT, "Unknown signal kind '" + rawKind + "'"));
        return relay.relay(kind, transportId, destinationTransportId, payload);
    }

    /** Re-sends roster and discussion state to the sender. */
    public void requestSync(String transportId) {
        SessionContext ctx = requireContext(transportId);
        Room room = requireRoom(ctx);
        broadcaster.rosterTo(transportId, room);
        broadcaster.discussionStateTo(transportId, room);
    }

    // ========================================================================
    //  READ VIEWS (REST)
    // ========================================================================

    public List<Map<String, Object>> roomSummaries() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Room room : registry.all()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", room.getCode());
            m.put("participantCount", room.size());
            m.put("status", room.getDiscussion().getStatus().name().toLowerCase(Locale.ROOT));
            m.put("round", room.getDiscussion().getRound());
            m.put("createdAt", room.getCreatedAt().toString());
            out.add(m);
        }
        return out;
    }

    public Map<String, Object> roomStats() {
        int participants = 0;
        int active = 0;
        Collection<Room> rooms = registry.all();
        for (Room room : rooms) {
            participants += room.size();
            if (room.getDiscussion().isActive()) active++;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("totalRooms", rooms.size());
        m.put("totalParticipants", participants);
        m.put("activeDiscussions", active);
        m.put("connectedTransports", broadcaster.connectedCount());
        m.put("timestamp", Instant.now().toString());
        return m;
    }

    public Optional<Map<String, Object>> discussionState(String roomId) {
        return registry.find(roomId).map(RoomBroadcaster::discussionState);
    }

    // ========================================================================
    //  INTERNAL
    // ========================================================================

    /**
     * Removes the context's identity from its room, unless the roster entry already belongs to a newer
     * transport. Notifies the rest of the room, re-anchors the engine and frees the room when it empties.
     */
    private void leaveCurrentRoom(SessionContext ctx, String reason) {
        contexts.computeIfPresent(ctx.transportId(), (k, v) -> v.withoutRoom());
        Room room = registry.find(ctx.roomId()).orElse(null);
        if (room == null) return;

        Participant p = room.find(ctx.identity()).orElse(null);
        if (p == null || !ctx.transportId().equals(p.getTransportId())) {
            log.debug("Stale transport {} left room {}, roster entry kept", ctx.transportId(), room.getCode());
            return;
        }

        int removedIndex = room.remove(ctx.identity());
        log.info("{} left room {} ({}, participants={})", ctx.identity(), room.getCode(), reason, room.size());

        broadcaster.rosterChanged(room);
        broadcaster.participantLeft(room, ctx.identity());
        engine.onParticipantRemoved(room, removedIndex);

        if (room.isEmpty()) registry.destroy(room);
    }

    /** An identity that reconnected on a new transport: the old transport no longer speaks for that room. */
    private void detachStaleTransport(Room room, String identity, String currentTransportId) {
        for (SessionContext other : contexts.values()) {
            if (!other.transportId().equals(currentTransportId)
                    && identity.equals(other.identity())
                    && room.getCode().equals(other.roomId())) {
                contexts.put(other.transportId(), other.withoutRoom());
                log.debug("Transport {} superseded by {} for {}", other.transportId(), currentTransportId, identity);
            }
        }
    }

    private SessionContext requireContext(String transportId) {
        SessionContext ctx = transportId == null ? null : contexts.get(transportId);
        if (ctx == null) {
            throw new RoundtableException(ErrorCode.INVALID_EVENT, "Unknown transport " + transportId);
        }
        return ctx;
    }

    private Room requireRoom(SessionContext ctx) {
        if (!ctx.inRoom()) {
            throw new RoundtableException(ErrorCode.NOT_IN_ROOM, "Join a room first");
        }
        Room room = registry.find(ctx.roomId()).orElseThrow(() ->
                new RoundtableException(ErrorCode.NOT_IN_ROOM, "Room " + ctx.roomId() + " no longer exists"));
        Participant p = room.find(ctx.identity()).orElse(null);
        if (p == null || !ctx.transportId().equals(p.getTransportId())) {
            throw new RoundtableException(ErrorCode.NOT_IN_ROOM, "Not a member of room " + room.getCode());
        }
        return room;
    }

    static String normalizeRoomId(String raw) {
        if (raw == null || raw.isBlank()) return DEFAULT_ROOM;
        String s = raw.trim();
        return s.length() > MAX_ROOM_ID_LENGTH ? s.substring(0, MAX_ROOM_ID_LENGTH) : s;
    }

    static String normalizeDisplayName(String raw) {
        if (raw == null || raw.isBlank()) return "Guest";
        String s = raw.trim();
        return s.length() > MAX_DISPLAY_NAME_LENGTH ? s.substring(0, MAX_DISPLAY_NAME_LENGTH) : s;
    }
}
