package com.example.roundtable.controller;

import com.example.roundtable.config.FeaturesProperties;
import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.topic.TopicService;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthAndConfigControllerTest {

    @Test
    void healthEndpoints() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController()).build();

        mvc.perform(get("/healthz")).andExpect(status().isOk()).andExpect(content().string("ok"));
        mvc.perform(get("/health")).andExpect(jsonPath("$.status").value("OK"));
        mvc.perform(get("/api/health")).andExpect(jsonPath("$.service").value(HealthController.SERVICE_NAME));
    }

    @Test
    void config_exposesRulesAndFeatures() throws Exception {
        TopicService topics = mock(TopicService.class);
        when(topics.isAiEnabled()).thenReturn(false);
        FeaturesProperties features = new FeaturesProperties(new FeaturesProperties.Analytics(true));
        MockMvc mvc = MockMvcBuilders
                .standaloneSetup(new ConfigController(RoundtableProperties.defaults(), features, topics))
                .build();

        mvc.perform(get("/api/config"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.minParticipants").value(1))
           .andExpect(jsonPath("$.maxSpeakers").value(6))
           .andExpect(jsonPath("$.turnDurationSeconds").value(60))
           .andExpect(jsonPath("$.maxRounds").value(3))
           .andExpect(jsonPath("$.features.aiTopics").value(false))
           .andExpect(jsonPath("$.features.analytics").value(true));
    }
}
