package com.ai.courseassistant.generation;

import com.ai.courseassistant.model.ContentType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Request modes. Student modes retrieve by similarity; faculty modes generate
 * from explicitly selected documents.
 */
public enum GenerationMode {
    QA(Audience.STUDENT),
    NOTES(Audience.STUDENT),
    PRACTICE(Audience.STUDENT),
    ASSIGNMENT(Audience.FACULTY),
    MCQ(Audience.FACULTY),
    VIVA(Audience.FACULTY);

    public enum Audience {
        STUDENT,
        FACULTY
    }

    private final Audience audience;

    GenerationMode(Audience audience) {
        this.audience = audience;
    }

    public Audience getAudience() {
        return audience;
    }

    public boolean isFaculty() {
        return audience == Audience.FACULTY;
    }

    public static GenerationMode forContentType(ContentType contentType) {
        return switch (contentType) {
            case ASSIGNMENT -> ASSIGNMENT;
            case MCQ -> MCQ;
            case VIVA -> VIVA;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static GenerationMode fromWireName(String value) {
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown mode: " + value));
    }
}
