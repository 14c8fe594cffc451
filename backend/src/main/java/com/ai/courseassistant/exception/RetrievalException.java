package com.ai.courseassistant.exception;

/** A query against the vector index failed. */
public class RetrievalException extends CourseAssistantException {

    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "RETRIEVAL_FAILED";
    }
}
