package com.ai.courseassistant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Represents a single multiple-choice question.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McqQuestion {

    @JsonProperty("question_number")
    private int questionNumber;

    private String question;

    /** Four answer options keyed "A" to "D". */
    private Map<String, String> options;

    /**
     * The correct option letter: "A", "B", "C", or "D".
     */
    @JsonProperty("correct_answer")
    private String correctAnswer;

    /** Brief explanation of why the correct answer is right. */
    private String explanation;
}
