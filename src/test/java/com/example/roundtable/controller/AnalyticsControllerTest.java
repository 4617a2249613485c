package com.example.roundtable.controller;

import com.example.roundtable.analytics.AnalyticsStats;
import com.example.roundtable.analytics.NoOpSessionAnalytics;
import com.example.roundtable.analytics.SessionAnalytics;
import com.example.roundtable.analytics.TopicUsage;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AnalyticsControllerTest {

    private MockMvc mockMvcWith(SessionAnalytics analytics) {
        return MockMvcBuilders.standaloneSetup(new AnalyticsController(analytics)).build();
    }

    @Nested
    class Sessions {

        @Test
        void limitIsBounded() throws Exception {
            SessionAnalytics analytics = mock(SessionAnalytics.class);
            when(analytics.recentSessions(anyInt())).thenReturn(List.of());

            mockMvcWith(analytics).perform(get("/api/analytics/sessions").param("limit", "5000"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.count").value(0));
            verify(analytics).recentSessions(AnalyticsController.MAX_LIMIT);
        }

        @Test
        void storeFailure_is500() throws Exception {
            SessionAnalytics analytics = mock(SessionAnalytics.class);
            when(analytics.recentSessions(anyInt())).thenThrow(new IllegalStateException("db"));

            mockMvcWith(analytics).perform(get("/api/analytics/sessions"))
               .andExpect(status().isInternalServerError())
               .andExpect(jsonPath("$.error").value("Failed to fetch sessions"));
        }
    }

    @Test
    void topics_listsUsage() throws Exception {
        SessionAnalytics analytics = mock(SessionAnalytics.class);
        when(analytics.topicUsage()).thenReturn(List.of(new TopicUsage("T", "d", "Work", "fallback", 4)));

        mockMvcWith(analytics).perform(get("/api/analytics/topics"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.data[0].usedCount").value(4));
    }

    @Test
    void stats_fromNoOpStore_areEmpty() throws Exception {
        mockMvcWith(new NoOpSessionAnalytics()).perform(get("/api/analytics/stats"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.data.totalSessions").value(0))
           .andExpect(jsonPath("$.data.topCategories").isEmpty());
    }

    @Test
    void stats_passThrough() throws Exception {
        SessionAnalytics analytics = mock(SessionAnalytics.class);
        when(analytics.stats()).thenReturn(new AnalyticsStats(2, 90.0, 3.0,
                List.of(new AnalyticsStats.CategoryCount("Work", 2))));

        mockMvcWith(analytics).perform(get("/api/analytics/stats"))
           .andExpect(jsonPath("$.data.avgSessionDuration").value(90.0))
           .andExpect(jsonPath("$.data.topCategories[0].category").value("Work"));
    }
}
