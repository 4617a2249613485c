package com.example.roundtable.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/** Discussion rules and topic source settings ("roundtable.*"). Values below 1 are clamped to 1. */
@ConfigurationProperties(prefix = "roundtable")
public record RoundtableProperties(
        @DefaultValue("1") int minParticipants,
        @DefaultValue("6") int maxSpeakers,
        @DefaultValue("60") int turnDurationSeconds,
        @DefaultValue("3") int maxRounds,
        @DefaultValue("100") int maxRooms,
        @DefaultValue("ANYONE") AdvancePolicy advancePolicy,
        @DefaultValue Topics topics
) {

    public static final String PLACEHOLDER_API_KEY = "your_huggingface_api_key_here";

    public RoundtableProperties {
        minParticipants = Math.max(1, minParticipants);
        maxSpeakers = Math.max(1, maxSpeakers);
        turnDurationSeconds = Math.max(1, turnDurationSeconds);
        maxRounds = Math.max(1, maxRounds);
        maxRooms = Math.max(1, maxRooms);
        if (advancePolicy == null) advancePolicy = AdvancePolicy.ANYONE;
        if (topics == null) topics = new Topics(null, null, null);
    }

    /** Defaults as documented; handy outside a Spring context. */
    public static RoundtableProperties defaults() {
        return new RoundtableProperties(1, 6, 60, 3, 100, AdvancePolicy.ANYONE, null);
    }

    /** Who may end the current turn early. */
    public enum AdvancePolicy {
        ANYONE,
        CURRENT_SPEAKER
    }

    public record Topics(
            String apiKey,
            @DefaultValue("https://api-inference.huggingface.co/models/microsoft/DialoGPT-medium") String endpoint,
            @DefaultValue("5s") Duration timeout
    ) {
        public Topics {
            if (endpoint == null || endpoint.isBlank()) {
                endpoint = "https://api-inference.huggingface.co/models/microsoft/DialoGPT-medium";
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) timeout = Duration.ofSeconds(5);
        }

        /** True when a real API key is configured. */
        public boolean aiEnabled() {
            return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_API_KEY.equals(apiKey.trim());
        }
    }
}
