package com.ai.courseassistant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VivaQuestion {

    @JsonProperty("question_number")
    private int questionNumber;

    private String question;

    private String type;

    /** Points an examiner expects in a good oral answer. */
    @JsonProperty("key_points")
    private List<String> keyPoints;

    private String difficulty;
}
