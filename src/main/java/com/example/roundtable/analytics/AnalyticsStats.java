package com.example.roundtable.analytics;

import java.util.List;

public record AnalyticsStats(
        long totalSessions,
        Double avgSessionDuration,
        Double avgParticipantsPerSession,
        List<CategoryCount> topCategories
) {

    public static AnalyticsStats empty() {
        return new AnalyticsStats(0, null, null, List.of());
    }

    public record CategoryCount(String category, long count) { }
}
