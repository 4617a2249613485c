package com.example.roundtable.model;

import java.util.Objects;

/**
 * Per-connection context threaded through the gateway: which transport, which claimed identity,
 * and the room the transport currently belongs to (null before the first join / after leave).
 */
public record SessionContext(String transportId, String identity, String displayName, String roomId) {

    public SessionContext {
        Objects.requireNonNull(transportId, "transportId");
        Objects.requireNonNull(identity, "identity");
        displayName = (displayName == null || displayName.isBlank()) ? "Guest" : displayName;
    }

    public boolean inRoom() {
        return roomId != null;
    }

    public SessionContext withRoom(String nextRoomId) {
        return new SessionContext(transportId, identity, displayName, nextRoomId);
    }

    public SessionContext withoutRoom() {
        return new SessionContext(transportId, identity, displayName, null);
    }
}
