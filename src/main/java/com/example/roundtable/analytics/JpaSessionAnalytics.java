package com.example.roundtable.analytics;

import com.example.roundtable.model.DiscussionSessionEntity;
import com.example.roundtable.model.Topic;
import com.example.roundtable.model.TopicUsageEntity;
import com.example.roundtable.repository.DiscussionSessionRepository;
import com.example.roundtable.repository.TopicUsageRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;

/**
 * Adapter on the JPA repositories. Writes are queued on a private thread so discussion start/end never
 * waits on the database; a failed write is logged and forgotten.
 */
public class JpaSessionAnalytics implements SessionAnalytics {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionAnalytics.class);

    private final DiscussionSessionRepository sessions;
    private final TopicUsageRepository topics;
    private final ExecutorService writer;

    public JpaSessionAnalytics(DiscussionSessionRepository sessions, TopicUsageRepository topics) {
        this(sessions, topics, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "analytics-writer");
            t.setDaemon(true);
            return t;
        }));
    }

    JpaSessionAnalytics(DiscussionSessionRepository sessions, TopicUsageRepository topics, ExecutorService writer) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    // ---------------------------------------------------------------------
    // Writes (fire-and-forget)
    // ---------------------------------------------------------------------

    @Override
    public void recordTopicUsage(Topic topic) {
        if (topic == null) return;
        submit("topic usage", () -> {
            TopicUsageEntity row = topics.findByTitleAndCategory(topic.title(), topic.category())
                    .orElseGet(() -> new TopicUsageEntity(topic.title(), topic.description(), topic.category(), topic.source()));
            row.markUsed();
            topics.save(row);
        });
    }

    @Override
    public void recordSession(DiscussionSummary s) {
        if (s == null) return;
        submit("session " + s.id(), () -> {
            DiscussionSessionEntity row = new DiscussionSessionEntity(s.id(), s.roomId());
            row.setTopicTitle(s.topicTitle());
            row.setTopicCategory(s.topicCategory());
            row.setParticipantCount(s.participantCount());
            row.setStartedAt(s.startedAt());
            row.setEndedAt(s.endedAt());
            row.setDurationSeconds(s.durationSeconds());
            row.setRoundsCompleted(s.roundsCompleted());
            row.setEndReason(s.endReason());
            sessions.save(row);
            log.debug("Session recorded (id={}, room={})", s.id(), s.roomId());
        });
    }

    private void submit(String what, Runnable write) {
        try {
            writer.execute(() -> {
                try {
                    write.run();
                } catch (Exception e) {
                    log.warn("Analytics write failed ({}): {}", what, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Analytics write dropped ({}): writer is shut down", what);
        }
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public List<DiscussionSummary> recentSessions(int limit) {
        int n = Math.max(1, Math.min(limit, 100));
        List<DiscussionSummary> out = new ArrayList<>();
        for (DiscussionSessionEntity e : sessions.findAllByOrderByStartedAtDesc(PageRequest.of(0, n))) {
            out.add(new DiscussionSummary(
                    e.getId(), e.getRoomId(), e.getTopicTitle(), e.getTopicCategory(), e.getParticipantCount(),
                    e.getStartedAt(), e.getEndedAt(), e.getDurationSeconds(), e.getRoundsCompleted(), e.getEndReason()));
        }
        return out;
    }

    @Override
    public List<TopicUsage> topicUsage() {
        List<TopicUsage> out = new ArrayList<>();
        for (TopicUsageEntity e : topics.findAllByOrderByUsedCountDescCreatedAtDesc()) {
            out.add(new TopicUsage(e.getTitle(), e.getDescription(), e.getCategory(), e.getSource(), e.getUsedCount()));
        }
        return out;
    }

    @Override
    public AnalyticsStats stats() {
        List<AnalyticsStats.CategoryCount> top = new ArrayList<>();
        for (Object[] row : topics.topCategories(PageRequest.of(0, 5))) {
            top.add(new AnalyticsStats.CategoryCount((String) row[0], ((Number) row[1]).longValue()));
        }
        return new AnalyticsStats(
                sessions.count(),
                sessions.averageDurationSeconds(),
                sessions.averageParticipantCount(),
                top);
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) writer.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
