package com.ai.courseassistant.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the ingestion and generation pipelines, bound from
 * {@code courseassistant.*} in application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "courseassistant")
public class CourseAssistantProperties {

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private Storage storage = new Storage();

    @Getter
    @Setter
    public static class Chunking {
        /** Maximum characters per chunk. */
        private int size = 1000;
        /** Characters shared by consecutive chunks. */
        private int overlap = 200;
    }

    @Getter
    @Setter
    public static class Retrieval {
        /** Hard cap on chunks concatenated for explicit-document context. */
        private int documentChunkCap = 20;
    }

    @Getter
    @Setter
    public static class Generation {
        /** Faculty-content prompts see at most this many context characters. */
        private int facultyContextChars = 3000;
        /** Upper bound for questions requested in one generation call. */
        private int maxQuestions = 20;
    }

    @Getter
    @Setter
    public static class Storage {
        private String uploadDir = "./data/uploads";
        private long maxFileSizeBytes = 50L * 1024 * 1024;
    }

    @PostConstruct
    void validate() {
        if (chunking.size <= 0) {
            throw new IllegalStateException("courseassistant.chunking.size must be positive");
        }
        if (chunking.overlap < 0 || chunking.overlap >= chunking.size) {
            throw new IllegalStateException(
                    "courseassistant.chunking.overlap must be >= 0 and smaller than the chunk size");
        }
        if (retrieval.documentChunkCap <= 0 || generation.facultyContextChars <= 0
                || generation.maxQuestions <= 0) {
            throw new IllegalStateException("courseassistant retrieval/generation limits must be positive");
        }
    }
}
