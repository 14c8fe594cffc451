package com.ai.courseassistant.dto;

import com.ai.courseassistant.model.CourseDocument;
import com.ai.courseassistant.model.DocumentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Document view returned by the upload and listing endpoints (no file path).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentResponse {

    private String documentId;
    private String filename;
    private String courseName;
    private String uploadedBy;
    private DocumentStatus status;
    private int chunkCount;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static DocumentResponse from(CourseDocument document) {
        return DocumentResponse.builder()
                .documentId(document.getId())
                .filename(document.getFilename())
                .courseName(document.getCourseName())
                .uploadedBy(document.getUploadedBy())
                .status(document.getStatus())
                .chunkCount(document.getChunkCount())
                .errorMessage(document.getErrorMessage())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }
}
