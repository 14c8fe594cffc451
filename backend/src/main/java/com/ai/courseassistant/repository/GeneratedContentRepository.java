package com.ai.courseassistant.repository;

import com.ai.courseassistant.model.GeneratedContent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeneratedContentRepository extends JpaRepository<GeneratedContent, String> {

    List<GeneratedContent> findByFacultyIdOrderByCreatedAtDesc(String facultyId);
}
