package com.example.roundtable.topic;

import com.example.roundtable.config.RoundtableProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TopicConfig {

    @Bean
    public RestTemplate topicRestTemplate(RestTemplateBuilder builder, RoundtableProperties props) {
        return builder
                .setConnectTimeout(props.topics().timeout())
                .setReadTimeout(props.topics().timeout())
                .build();
    }

    /** Topic requests never run on the roundtable loop. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService topicExecutor() {
        return Executors.newFixedThreadPool(2, new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "topic-source-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }
}
