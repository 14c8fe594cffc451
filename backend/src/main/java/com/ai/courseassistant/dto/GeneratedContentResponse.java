package com.ai.courseassistant.dto;

import com.ai.courseassistant.model.ContentType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class GeneratedContentResponse {

    private String contentId;

    private ContentType contentType;

    private String facultyId;

    private List<String> documentIds;

    /** Question objects shaped per content type. */
    private List<JsonNode> questions;

    private int totalQuestions;

    /** PARSED, PADDED or SYNTHESIZED. */
    private String origin;

    private LocalDateTime createdAt;
}
