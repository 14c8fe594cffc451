package com.ai.courseassistant.generation;

import lombok.Builder;
import lombok.Value;

/**
 * Slot values for one generation call. Student modes use {@code question};
 * faculty modes use {@code numQuestions} and {@code difficulty}.
 */
@Value
@Builder
public class GenerationRequest {

    String context;

    String question;

    int numQuestions;

    String difficulty;
}
