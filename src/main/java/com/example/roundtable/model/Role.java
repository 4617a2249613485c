package com.example.roundtable.model;

import java.util.Locale;
import java.util.Optional;

/** Speaking role inside a room. Speakers publish audio, listeners only receive. */
public enum Role {
    SPEAKER,
    LISTENER;

    /** Wire form ("speaker" / "listener"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Role> parse(String raw) {
        if (raw == null) return Optional.empty();
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "speaker":  return Optional.of(SPEAKER);
            case "listener": return Optional.of(LISTENER);
            default:         return Optional.empty();
        }
    }
}
