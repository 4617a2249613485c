package com.example.roundtable.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class FeedbackControllerTest {

    private final MockMvc mvc = MockMvcBuilders.standaloneSetup(new FeedbackController()).build();

    @Test
    void validRating_accepted() throws Exception {
        mvc.perform(post("/api/feedback").contentType(MediaType.APPLICATION_JSON)
                .content("{\"rating\":4,\"comment\":\"good flow\",\"sessionId\":\"s-1\"}"))
           .andExpect(status().isOk())
           .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void ratingOutOfRange_rejected() throws Exception {
        mvc.perform(post("/api/feedback").contentType(MediaType.APPLICATION_JSON)
                .content("{\"rating\":9}"))
           .andExpect(status().isBadRequest())
           .andExpect(jsonPath("$.error").value("Rating must be between 1 and 5"));
    }

    @Test
    void missingRating_rejected() throws Exception {
        mvc.perform(post("/api/feedback").contentType(MediaType.APPLICATION_JSON)
                .content("{\"comment\":\"no rating\"}"))
           .andExpect(status().isBadRequest());
    }
}
