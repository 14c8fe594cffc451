package com.ai.courseassistant.controller;

import com.ai.courseassistant.client.LlmClient;
import com.ai.courseassistant.index.EmbeddingIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private EmbeddingIndex embeddingIndex;

    @Mock
    private LlmClient llmClient;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(embeddingIndex, llmClient)).build();
    }

    @Test
    void reportsBothServicesOperational() throws Exception {
        when(embeddingIndex.count()).thenReturn(12L);
        when(llmClient.complete(anyString(), anyDouble(), anyInt())).thenReturn("Hi");

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vectorStore").value("operational (12 chunks)"))
                .andExpect(jsonPath("$.llm").value("operational"));
    }

    @Test
    void reportsUnavailableServicesWithoutFailing() throws Exception {
        when(embeddingIndex.count()).thenThrow(new IllegalStateException("connection refused"));
        when(llmClient.complete(anyString(), anyDouble(), anyInt())).thenThrow(new IllegalStateException("timeout"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vectorStore").value("unavailable"))
                .andExpect(jsonPath("$.llm").value("unavailable"));
    }
}
