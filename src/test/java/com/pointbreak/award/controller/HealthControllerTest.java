package com.pointbreak.award.controller;

import com.pointbreak.award.session.PoolStats;
import com.pointbreak.award.session.SessionPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
public class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionPool sessionPool;

    @Test
    void health_alwaysOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void ready_withWarmingSession_up() throws Exception {
        when(sessionPool.stats()).thenReturn(new PoolStats(1, 0, 0, 0, 0, 0));

        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.pool.warming").value(1));
    }

    @Test
    void ready_onlyDegradedSessions_down() throws Exception {
        when(sessionPool.stats()).thenReturn(new PoolStats(0, 0, 0, 2, 5, 1));

        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.pool.degraded").value(2))
                .andExpect(jsonPath("$.pool.retired").value(5))
                .andExpect(jsonPath("$.pool.waiting").value(1));
    }
}
