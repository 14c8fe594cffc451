package com.ai.courseassistant.exception;

/**
 * Any failure between "file on disk" and "chunks in the index". The caller
 * records the message as the document's terminal {@code failed} state.
 */
public abstract class IngestionException extends CourseAssistantException {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
