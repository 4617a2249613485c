package com.example.roundtable.analytics;

/** How often a topic has been used to open a discussion. */
public record TopicUsage(String title, String description, String category, String source, long usedCount) { }
