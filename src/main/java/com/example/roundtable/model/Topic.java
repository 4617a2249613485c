package com.example.roundtable.model;

import java.util.List;
import java.util.Objects;

/** Discussion topic handed to a room when its discussion starts. */
public record Topic(String title, String description, String category, List<String> questions, String source) {

    public Topic {
        Objects.requireNonNull(title, "title");
        questions = (questions == null) ? List.of() : List.copyOf(questions);
        source = (source == null || source.isBlank()) ? "fallback" : source;
    }
}
