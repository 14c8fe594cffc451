package com.ai.courseassistant.dto;

import com.ai.courseassistant.generation.GenerationMode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response body for POST /api/student/ask
 */
@Data
@Builder
public class StudentAnswerResponse {

    private GenerationMode mode;

    private String query;

    /** The LLM-generated answer, grounded in retrieved course material. */
    private String answer;

    /** Distinct filenames of the documents the answer drew on. */
    private List<String> sources;

    /** How many chunks were retrieved from the index. */
    private int chunksUsed;
}
