package com.ai.courseassistant.exception;

/** The generative model call failed. Never retried. */
public class GenerationException extends CourseAssistantException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "GENERATION_FAILED";
    }
}
