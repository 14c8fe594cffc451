package com.ai.courseassistant.dto;

import com.ai.courseassistant.generation.GenerationMode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request body for POST /api/student/ask
 */
@Data
public class StudentQueryRequest {

    private String userId;

    @NotBlank(message = "Query must not be blank")
    private String query;

    /** qa | notes | practice; defaults to qa. */
    private GenerationMode mode = GenerationMode.QA;
}
