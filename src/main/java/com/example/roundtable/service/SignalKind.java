package com.example.roundtable.service;

import java.util.Locale;
import java.util.Optional;

/** Connection-setup messages the relay forwards between two transports. */
public enum SignalKind {
    OFFER("offer"),
    ANSWER("answer"),
    CANDIDATE("candidate");

    private final String wireName;

    SignalKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SignalKind> parse(String raw) {
        if (raw == null) return Optional.empty();
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "offer":         return Optional.of(OFFER);
            case "answer":        return Optional.of(ANSWER);
            case "candidate":
            case "ice-candidate": return Optional.of(CANDIDATE);
            default:              return Optional.empty();
        }
    }
}
