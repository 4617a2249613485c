package com.example.roundtable.topic;

import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.model.Topic;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.*;

/**
 * Topic generator backed by a Hugging Face text-generation endpoint.
 * Without an API key it reports "nothing" and the caller falls back to static topics.
 */
@Component
public class HuggingFaceTopicSource implements TopicSource {

    private static final Logger log = LoggerFactory.getLogger(HuggingFaceTopicSource.class);

    static final String SOURCE = "AI Generated";
    private static final int MAX_TITLE = 50;

    private static final String PROMPT =
            "Generate an engaging discussion topic for an educational roundtable. Include:\n"
            + "1. A compelling title (max 50 characters)\n"
            + "2. A brief description (max 200 characters)\n"
            + "3. A category (Education, Technology, Health, Environment, etc.)\n"
            + "4. 3 thought-provoking questions\n"
            + "\n"
            + "Topic:";

    private static final List<String> GENERIC_QUESTIONS = List.of(
            "What are your initial thoughts on this topic?",
            "How does this relate to your personal experience?",
            "What aspects would you like to explore further?"
    );

    private final RestTemplate restTemplate;
    private final RoundtableProperties.Topics settings;

    public HuggingFaceTopicSource(RestTemplate topicRestTemplate, RoundtableProperties props) {
        this.restTemplate = topicRestTemplate;
        this.settings = props.topics();
    }

    @Override
    public Optional<Topic> fetch() {
        if (!settings.aiEnabled()) {
            log.debug("No Hugging Face API key configured, skipping AI topic");
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.apiKey().trim());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("inputs", PROMPT);
        body.put("parameters", Map.of(
                "max_length", 300,
                "temperature", 0.8,
                "num_return_sequences", 1));

        // RestClientException on non-2xx or I/O problems; TopicService turns that into the fallback
        ResponseEntity<JsonNode> response =
                restTemplate.postForEntity(settings.endpoint(), new HttpEntity<>(body, headers), JsonNode.class);

        JsonNode data = response.getBody();
        if (data == null || !data.isArray() || data.isEmpty()) return Optional.empty();
        JsonNode text = data.get(0).get("generated_text");
        if (text == null || !text.isTextual()) return Optional.empty();
        return parse(text.asText());
    }

    /** First meaningful line becomes the title; the rest of the topic is generic. */
    static Optional<Topic> parse(String generated) {
        if (generated == null) return Optional.empty();
        String title = Arrays.stream(generated.split("\n"))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .findFirst()
                .map(l -> l.replaceFirst("^\\d+\\.\\s*", "").trim())
                .filter(l -> !l.isEmpty())
                .orElse("AI-Generated Discussion Topic");

        String shown = title.length() > MAX_TITLE ? title.substring(0, MAX_TITLE - 3) + "..." : title;

        return Optional.of(new Topic(
                shown,
                "An AI-generated topic focusing on " + title.toLowerCase(Locale.ROOT) + ".",
                SOURCE,
                GENERIC_QUESTIONS,
                SOURCE));
    }
}
