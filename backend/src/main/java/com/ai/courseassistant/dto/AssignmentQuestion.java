package com.ai.courseassistant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A written assignment question with marks and marking scheme.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentQuestion {

    /** 1-based position in the assignment. */
    @JsonProperty("question_number")
    private int questionNumber;

    private String question;

    /** theory / numerical / analytical / application */
    private String type;

    private int marks;

    @JsonProperty("marking_scheme")
    private String markingScheme;

    @JsonProperty("sample_answer")
    private String sampleAnswer;
}
