package com.ai.courseassistant.dto;

import com.ai.courseassistant.model.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for POST /api/faculty/content
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentGenerationRequest {

    @NotBlank(message = "facultyId is required")
    private String facultyId;

    @NotNull(message = "contentType is required")
    private ContentType contentType;

    @NotEmpty(message = "Select at least one document")
    private List<String> documentIds;

    /** Optional; defaults per content type. */
    private Integer numQuestions;

    /** easy | medium | hard; ignored for viva. */
    private String difficulty;
}
