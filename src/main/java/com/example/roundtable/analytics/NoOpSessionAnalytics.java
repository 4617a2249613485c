package com.example.roundtable.analytics;

import com.example.roundtable.model.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-op adapter for deployments without analytics storage.
 */
public class NoOpSessionAnalytics implements SessionAnalytics {

    private static final Logger log = LoggerFactory.getLogger(NoOpSessionAnalytics.class);

    @Override
    public void recordTopicUsage(Topic topic) {
        log.debug("NoOp recordTopicUsage: {}", topic == null ? null : topic.title());
    }

    @Override
    public void recordSession(DiscussionSummary summary) {
        log.debug("NoOp recordSession: room={}", summary == null ? null : summary.roomId());
    }
}
