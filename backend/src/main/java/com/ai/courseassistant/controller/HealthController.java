package com.ai.courseassistant.controller;

import com.ai.courseassistant.client.LlmClient;
import com.ai.courseassistant.index.EmbeddingIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports whether the vector index and the generative model are reachable.
 */
@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingIndex embeddingIndex;
    private final LlmClient llmClient;

    @GetMapping
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> status = new LinkedHashMap<>();
        status.put("vectorStore", vectorStoreStatus());
        status.put("llm", llmStatus());
        return ResponseEntity.ok(status);
    }

    private String vectorStoreStatus() {
        try {
            return "operational (" + embeddingIndex.count() + " chunks)";
        } catch (RuntimeException e) {
            log.warn("Vector store health check failed: {}", e.getMessage());
            return "unavailable";
        }
    }

    private String llmStatus() {
        try {
            llmClient.complete("Hello", 0.0, 8);
            return "operational";
        } catch (RuntimeException e) {
            log.warn("LLM health check failed: {}", e.getMessage());
            return "unavailable";
        }
    }
}
