package com.example.roundtable.analytics;

import java.time.Instant;

/** What is recorded about a discussion once it ends. */
public record DiscussionSummary(
        String id,
        String roomId,
        String topicTitle,
        String topicCategory,
        int participantCount,
        Instant startedAt,
        Instant endedAt,
        long durationSeconds,
        int roundsCompleted,
        String endReason
) { }
