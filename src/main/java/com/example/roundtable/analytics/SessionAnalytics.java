package com.example.roundtable.analytics;

import com.example.roundtable.model.Topic;

import java.util.List;

/**
 * Port for discussion analytics. Writes are fire-and-forget: implementations must not block the caller
 * and must not throw. Read methods default to "nothing recorded" so a no-op store stays valid.
 */
public interface SessionAnalytics {

    /** Called when a discussion starts with this topic. */
    void recordTopicUsage(Topic topic);

    /** Called when a discussion ends. */
    void recordSession(DiscussionSummary summary);

    default List<DiscussionSummary> recentSessions(int limit) {
        return List.of();
    }

    default List<TopicUsage> topicUsage() {
        return List.of();
    }

    default AnalyticsStats stats() {
        return AnalyticsStats.empty();
    }
}
