package com.example.roundtable.topic;

import com.example.roundtable.model.Topic;

import java.util.Optional;

/**
 * Port for an external topic generator.
 * Implementations may block; TopicService calls them off the event loop.
 */
public interface TopicSource {

    /** @return a generated topic, or empty when the source is not configured / produced nothing */
    Optional<Topic> fetch();
}
