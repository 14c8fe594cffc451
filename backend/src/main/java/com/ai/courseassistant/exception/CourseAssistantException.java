package com.ai.courseassistant.exception;

/**
 * Root of the pipeline's unchecked error hierarchy. Each subclass carries a
 * stable error code that the {@link GlobalExceptionHandler} reports to clients.
 */
public abstract class CourseAssistantException extends RuntimeException {

    protected CourseAssistantException(String message) {
        super(message);
    }

    protected CourseAssistantException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();
}
