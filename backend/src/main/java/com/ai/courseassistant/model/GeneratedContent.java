package com.ai.courseassistant.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A set of generated assessment questions. Written once, never updated.
 *
 * Questions are kept as the JSON array returned by the resolver so that parsed
 * model output is stored exactly as received.
 */
@Entity
@Immutable
@Table(name = "generated_content")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedContent {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20, updatable = false)
    private ContentType contentType;

    @Column(name = "faculty_id", nullable = false, updatable = false)
    private String facultyId;

    /** Comma-separated source document ids, in request order. */
    @Column(name = "document_ids", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String documentIds;

    @Column(name = "questions_json", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String questionsJson;

    /** PARSED / PADDED / SYNTHESIZED, see ResolvedQuestions.Origin */
    @Column(length = 20, updatable = false)
    private String origin;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
