package com.example.roundtable.model;

import java.time.Instant;
import java.util.*;

/**
 * Room model: ordered roster (order = speaking order) plus the discussion state.
 * The roster knows nothing about the current speaker; DiscussionEngine re-anchors its index after removals.
 * All mutation happens on the event loop thread, so this class does not add locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;
    private final int maxSpeakers;
    private final Instant createdAt = Instant.now();

    /** Speaking order. At most one entry per identity. */
    private final List<Participant> participants = new ArrayList<>();

    private final Discussion discussion;

    /** Set once the registry has dropped this room; late callbacks check it before touching state. */
    private boolean closed = false;

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String code, int turnDurationSeconds, int maxSpeakers) {
        this.code = (code == null || code.isBlank()) ? "general" : code.trim();
        this.maxSpeakers = Math.max(1, maxSpeakers);
        this.discussion = new Discussion(turnDurationSeconds);
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() { return code; }
    public int getMaxSpeakers() { return maxSpeakers; }
    public Instant getCreatedAt() { return createdAt; }
    public Discussion getDiscussion() { return discussion; }

    public boolean isClosed() { return closed; }
    public void markClosed() { this.closed = true; }

    // ---------------------------------------------------------------------
    // Roster queries
    // ---------------------------------------------------------------------

    /** Snapshot in speaking order. */
    public List<Participant> getParticipants() {
        return new ArrayList<>(participants);
    }

    public int size() { return participants.size(); }
    public boolean isEmpty() { return participants.isEmpty(); }

    public long readyCount() {
        return participants.stream().filter(Participant::isReady).count();
    }

    public long speakerCount() {
        return participants.stream().filter(p -> p.getRole() == Role.SPEAKER).count();
    }

    public Optional<Participant> find(String identity) {
        if (identity == null) return Optional.empty();
        for (Participant p : participants) {
            if (identity.equals(p.getIdentity())) return Optional.of(p);
        }
        return Optional.empty();
    }

    public Optional<Participant> findByTransport(String transportId) {
        if (transportId == null) return Optional.empty();
        for (Participant p : participants) {
            if (transportId.equals(p.getTransportId())) return Optional.of(p);
        }
        return Optional.empty();
    }

    public int indexOf(String identity) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).getIdentity().equals(identity)) return i;
        }
        return -1;
    }

    public Participant participantAt(int index) {
        if (index < 0 || index >= participants.size()) return null;
        return participants.get(index);
    }

    /** Current speaker, if a discussion is running and the index is in range. */
    public Optional<Participant> currentSpeaker() {
        if (!discussion.isActive()) return Optional.empty();
        return Optional.ofNullable(participantAt(discussion.getSpeakerIndex()));
    }

    // ---------------------------------------------------------------------
    // Roster mutations
    // ---------------------------------------------------------------------

    /**
     * Adds or replaces by identity. A replacement keeps its slot, readiness and join time and takes over
     * the new transport, handle and requested role (reconnect). A requested speaker role that does not fit
     * into the free speaker slots is admitted as listener.
     *
     * @return roster snapshot after the change
     */
    public List<Participant> add(Participant incoming) {
        Objects.requireNonNull(incoming, "incoming");
        int idx = indexOf(incoming.getIdentity());
        Participant existing = idx >= 0 ? participants.get(idx) : null;

        Role requested = incoming.getRole();
        if (requested == Role.SPEAKER && !hasSpeakerSlotFor(existing)) {
            incoming.setRole(Role.LISTENER);
        }

        if (existing == null) {
            participants.add(incoming);
        } else {
            existing.setTransportId(incoming.getTransportId());
            existing.setDisplayName(incoming.getDisplayName());
            existing.setRole(incoming.getRole());
        }
        return getParticipants();
    }

    /** Removes by identity. Returns the index the participant held, or -1 if absent. */
    public int remove(String identity) {
        int idx = indexOf(identity);
        if (idx >= 0) participants.remove(idx);
        return idx;
    }

    /**
     * Changes a role under the speaker capacity policy.
     *
     * @throws RoundtableException NOT_IN_ROOM or INVALID_ROLE
     * @throws CapacityExceededException when no speaker slot is left
     */
    public Participant updateRole(String identity, Role role) {
        Participant p = find(identity).orElseThrow(() ->
                new RoundtableException(ErrorCode.NOT_IN_ROOM, "Participant " + identity + " is not in room " + code));
        if (role == null) {
            throw new RoundtableException(ErrorCode.INVALID_ROLE, "Role must be 'speaker' or 'listener'");
        }
        if (role == Role.SPEAKER && !hasSpeakerSlotFor(p)) {
            throw new CapacityExceededException(maxSpeakers);
        }
        p.setRole(role);
        return p;
    }

    public Participant setReady(String identity, boolean ready) {
        Participant p = find(identity).orElseThrow(() ->
                new RoundtableException(ErrorCode.NOT_IN_ROOM, "Participant " + identity + " is not in room " + code));
        p.setReady(ready);
        return p;
    }

    /** A participant already holding a speaker slot keeps it. */
    private boolean hasSpeakerSlotFor(Participant self) {
        if (self != null && self.getRole() == Role.SPEAKER) return true;
        return speakerCount() < maxSpeakers;
    }
}
