package com.example.roundtable.model;

import java.time.Instant;
import java.util.Objects;

/** Roster entry. Keyed by identity; the transport id changes whenever the client reconnects. */
public class Participant {

    private final String identity;
    private String transportId;
    private String displayName;
    private Role role = Role.LISTENER;
    private boolean ready = false;
    private Instant joinedAt = Instant.now();

    public Participant(String identity, String transportId, String displayName) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.transportId = Objects.requireNonNull(transportId, "transportId");
        this.displayName = (displayName == null || displayName.isBlank()) ? "Guest" : displayName.trim();
    }

    // identity
    public String getIdentity() { return identity; }

    // transport
    public String getTransportId() { return transportId; }
    public void setTransportId(String transportId) { this.transportId = Objects.requireNonNull(transportId, "transportId"); }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    // role / readiness
    public Role getRole() { return role; }
    public void setRole(Role role) { this.role = Objects.requireNonNull(role, "role"); }

    public boolean isReady() { return ready; }
    public void setReady(boolean ready) { this.ready = ready; }

    public Instant getJoinedAt() { return joinedAt; }
    public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }

    @Override
    public String toString() {
        return "Participant{" +
                "identity='" + identity + '\'' +
                ", transportId='" + transportId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", role=" + role +
                ", ready=" + ready +
                ", joinedAt=" + joinedAt +
                '}';
    }
}
