package com.ai.courseassistant.service;

import com.ai.courseassistant.model.ActivityEvent;
import com.ai.courseassistant.repository.ActivityEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Records analytics events. Logging never fails the request that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    public static final String DOCUMENT_PROCESSED = "document_processed";
    public static final String CHAT_INTERACTION = "chat_interaction";
    public static final String CONTENT_GENERATED = "content_generated";

    private final ActivityEventRepository activityEventRepository;
    private final ObjectMapper objectMapper;

    public void logDocumentProcessed(String userId, String documentId, int chunksCreated) {
        logEvent(userId, DOCUMENT_PROCESSED, Map.of("doc_id", documentId, "chunks", chunksCreated));
    }

    public void logChatInteraction(String userId, String mode) {
        logEvent(userId, CHAT_INTERACTION, Map.of("mode", mode));
    }

    public void logContentGeneration(String facultyId, String contentType, int numItems) {
        logEvent(facultyId, CONTENT_GENERATED, Map.of("content_type", contentType, "num_items", numItems));
    }

    public void logEvent(String userId, String eventType, Map<String, Object> data) {
        try {
            activityEventRepository.save(ActivityEvent.builder()
                    .userId(userId)
                    .eventType(eventType)
                    .eventData(data == null ? null : objectMapper.writeValueAsString(data))
                    .build());
            log.debug("Activity logged: user={}, type={}", userId, eventType);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to log activity event (non-fatal): type={}, error={}", eventType, e.getMessage());
        }
    }
}
