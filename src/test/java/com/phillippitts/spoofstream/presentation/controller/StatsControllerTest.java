package com.phillippitts.spoofstream.presentation.controller;

import com.phillippitts.spoofstream.config.properties.SessionProperties.DuplicatePolicy;
import com.phillippitts.spoofstream.service.session.ConnectionRegistry;
import com.phillippitts.spoofstream.service.session.ConnectionSession;
import com.phillippitts.spoofstream.testutil.RecordingMessageSink;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StatsControllerTest {

    @Test
    void aggregatesLiveConnections() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(DuplicatePolicy.REJECT_NEW, Clock.systemUTC());
        ConnectionSession.WindowSettings settings = new ConnectionSession.WindowSettings(16_000, 1.0, 0.5, 1.0);
        registry.register("alice", new ConnectionSession("t1", new RecordingMessageSink(), settings, Clock.systemUTC()));
        registry.register("bob", new ConnectionSession("t2", new RecordingMessageSink(), settings, Clock.systemUTC()));
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new StatsController(registry)).build();

        mvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/json"))
                .andExpect(jsonPath("$.total_connections").value(2))
                .andExpect(jsonPath("$.total_detections").value(0))
                .andExpect(jsonPath("$.uptime_seconds").isNumber())
                .andExpect(jsonPath("$.connections.alice.client_id").value("alice"))
                .andExpect(jsonPath("$.connections.bob.sample_rate").value(16_000))
                .andExpect(jsonPath("$.connections.bob.buffer_size").value(0));
    }

    @Test
    void emptyRegistryHasNoConnections() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry(DuplicatePolicy.REJECT_NEW, Clock.systemUTC());
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new StatsController(registry)).build();

        mvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_connections").value(0))
                .andExpect(jsonPath("$.connections").isEmpty());
    }
}
