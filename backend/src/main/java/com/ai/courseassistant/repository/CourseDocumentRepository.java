package com.ai.courseassistant.repository;

import com.ai.courseassistant.model.CourseDocument;
import com.ai.courseassistant.model.DocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for CourseDocument entities.
 * Backed by the `documents` table in PostgreSQL.
 */
@Repository
public interface CourseDocumentRepository extends JpaRepository<CourseDocument, String> {

    /**
     * Retrieve all documents uploaded by a user, most recent first.
     */
    List<CourseDocument> findByUploadedByOrderByCreatedAtDesc(String uploadedBy);

    List<CourseDocument> findByStatusOrderByCreatedAtDesc(DocumentStatus status);
}
