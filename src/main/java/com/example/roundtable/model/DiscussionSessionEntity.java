package com.example.roundtable.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

@Entity
@Table(
    name = "discussion_sessions",
    indexes = {
        @Index(name = "idx_discussion_sessions_started_at", columnList = "startedAt"),
        @Index(name = "idx_discussion_sessions_room_id", columnList = "roomId")
    }
)
public class DiscussionSessionEntity {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, length = 100)
    private String roomId;

    @Column(length = 200)
    private String topicTitle;

    @Column(length = 100)
    private String topicCategory;

    private int participantCount;

    private Instant startedAt;
    private Instant endedAt;
    private long durationSeconds;
    private int roundsCompleted;

    @Column(length = 40)
    private String endReason;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    protected DiscussionSessionEntity() {}

    public DiscussionSessionEntity(String id, String roomId) {
        this.id = id;
        this.roomId = roomId;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) this.createdAt = Instant.now();
    }

    public String getId() { return id; }

    public String getRoomId() { return roomId; }
    public void setRoomId(String roomId) { this.roomId = roomId; }

    public String getTopicTitle() { return topicTitle; }
    public void setTopicTitle(String topicTitle) { this.topicTitle = topicTitle; }

    public String getTopicCategory() { return topicCategory; }
    public void setTopicCategory(String topicCategory) { this.topicCategory = topicCategory; }

    public int getParticipantCount() { return participantCount; }
    public void setParticipantCount(int participantCount) { this.participantCount = participantCount; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public long getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(long durationSeconds) { this.durationSeconds = durationSeconds; }

    public int getRoundsCompleted() { return roundsCompleted; }
    public void setRoundsCompleted(int roundsCompleted) { this.roundsCompleted = roundsCompleted; }

    public String getEndReason() { return endReason; }
    public void setEndReason(String endReason) { this.endReason = endReason; }

    public Instant getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return "DiscussionSessionEntity{" +
                "id='" + id + '\'' +
                ", roomId='" + roomId + '\'' +
                ", topicTitle='" + topicTitle + '\'' +
                ", participantCount=" + participantCount +
                ", durationSeconds=" + durationSeconds +
                ", roundsCompleted=" + roundsCompleted +
                '}';
    }
}
