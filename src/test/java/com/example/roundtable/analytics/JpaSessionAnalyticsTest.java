package com.example.roundtable.analytics;

import com.example.roundtable.model.DiscussionSessionEntity;
import com.example.roundtable.model.Topic;
import com.example.roundtable.model.TopicUsageEntity;
import com.example.roundtable.repository.DiscussionSessionRepository;
import com.example.roundtable.repository.TopicUsageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JpaSessionAnalyticsTest {

    private DiscussionSessionRepository sessions;
    private TopicUsageRepository topics;
    private JpaSessionAnalytics analytics;

    @BeforeEach
    void setUp() {
        sessions = mock(DiscussionSessionRepository.class);
        topics = mock(TopicUsageRepository.class);
        analytics = new JpaSessionAnalytics(sessions, topics, Executors.newSingleThreadExecutor());
    }

    @Test
    void recordSession_persistsSummary() {
        Instant start = Instant.parse("2024-01-01T10:00:00Z");
        analytics.recordSession(new DiscussionSummary("id-1", "r1", "T", "Work", 3,
                start, start.plusSeconds(200), 200, 2, "rounds-complete"));
        analytics.shutdown(); // drains the writer

        ArgumentCaptor<DiscussionSessionEntity> cap = ArgumentCaptor.forClass(DiscussionSessionEntity.class);
        verify(sessions).save(cap.capture());
        DiscussionSessionEntity e = cap.getValue();
        assertEquals("id-1", e.getId());
        assertEquals("r1", e.getRoomId());
        assertEquals(3, e.getParticipantCount());
        assertEquals(200, e.getDurationSeconds());
        assertEquals(2, e.getRoundsCompleted());
    }

    @Test
    void recordTopicUsage_upsertsByTitleAndCategory() {
        TopicUsageEntity existing = new TopicUsageEntity("T", "d", "Work", "fallback");
        existing.markUsed();
        when(topics.findByTitleAndCategory("T", "Work")).thenReturn(Optional.of(existing));
        when(topics.findByTitleAndCategory("New", "Work")).thenReturn(Optional.empty());

        analytics.recordTopicUsage(new Topic("T", "d", "Work", List.of(), "fallback"));
        analytics.recordTopicUsage(new Topic("New", "d", "Work", List.of(), "fallback"));
        analytics.shutdown();

        ArgumentCaptor<TopicUsageEntity> cap = ArgumentCaptor.forClass(TopicUsageEntity.class);
        verify(topics, times(2)).save(cap.capture());
        assertSame(existing, cap.getAllValues().get(0));
        assertEquals(2, existing.getUsedCount());
        assertEquals(1, cap.getAllValues().get(1).getUsedCount());
    }

    @Test
    void failingWrite_isSwallowed() {
        when(sessions.save(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> {
            analytics.recordSession(new DiscussionSummary("id-2", "r1", null, null, 1,
                    Instant.now(), Instant.now(), 0, 0, "x"));
            analytics.shutdown();
        });
        verify(sessions).save(any());
    }

    @Test
    void writeAfterShutdown_isDropped() {
        analytics.shutdown();
        assertDoesNotThrow(() -> analytics.recordTopicUsage(new Topic("T", "d", "Work", List.of(), "fallback")));
        verifyNoInteractions(topics);
    }

    @Test
    void stats_combinesCountsAveragesAndTopCategories() {
        when(sessions.count()).thenReturn(4L);
        when(sessions.averageDurationSeconds()).thenReturn(120.0);
        when(sessions.averageParticipantCount()).thenReturn(2.5);
        when(topics.topCategories(any(Pageable.class))).thenReturn(List.<Object[]>of(
                new Object[]{"Work", 3L}, new Object[]{"Health", 1L}));

        AnalyticsStats s = analytics.stats();

        assertEquals(4, s.totalSessions());
        assertEquals(120.0, s.avgSessionDuration());
        assertEquals(2.5, s.avgParticipantsPerSession());
        assertEquals(List.of(new AnalyticsStats.CategoryCount("Work", 3), new AnalyticsStats.CategoryCount("Health", 1)),
                s.topCategories());
    }
}
