package com.example.roundtable.topic;

import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.model.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Topic acquisition for discussion start. Asks the generator on its own executor, bounded by a timeout,
 * and always completes with a topic: any failure or empty answer becomes a random fallback topic.
 */
@Service
public class TopicService {

    private static final Logger log = LoggerFactory.getLogger(TopicService.class);

    private final TopicSource source;
    private final Executor executor;
    private final Duration timeout;
    private final boolean aiEnabled;

    public TopicService(TopicSource source,
                        @Qualifier("topicExecutor") Executor executor,
                        RoundtableProperties props) {
        this.source = source;
        this.executor = executor;
        this.timeout = props.topics().timeout();
        this.aiEnabled = props.topics().aiEnabled();
    }

    /** Never completes exceptionally. */
    public CompletableFuture<Topic> nextTopic() {
        CompletableFuture<Optional<Topic>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(source::fetch, executor);
        } catch (RuntimeException e) {
            // executor rejected the task (shutting down)
            fetch = CompletableFuture.failedFuture(e);
        }
        return fetch
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((generated, ex) -> {
                    if (ex != null) {
                        log.warn("Topic generation failed, using fallback: {}", ex.toString());
                        return FallbackTopics.random();
                    }
                    if (generated == null || generated.isEmpty()) {
                        Topic t = FallbackTopics.random();
                        log.info("Selected fallback topic: {}", t.title());
                        return t;
                    }
                    return generated.get();
                });
    }

    public List<Topic> fallbackTopics() {
        return FallbackTopics.all();
    }

    public Optional<Topic> byCategory(String category) {
        return FallbackTopics.byCategory(category);
    }

    public boolean isAiEnabled() {
        return aiEnabled;
    }
}
