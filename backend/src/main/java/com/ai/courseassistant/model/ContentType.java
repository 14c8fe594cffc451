package com.ai.courseassistant.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Kinds of faculty assessment content. */
public enum ContentType {
    ASSIGNMENT(5),
    MCQ(10),
    VIVA(10);

    private final int defaultQuestionCount;

    ContentType(int defaultQuestionCount) {
        this.defaultQuestionCount = defaultQuestionCount;
    }

    public int getDefaultQuestionCount() {
        return defaultQuestionCount;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ContentType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown content type: " + value));
    }
}
