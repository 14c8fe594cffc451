package com.ai.courseassistant.exception;

/**
 * The document exists but its status does not allow the requested operation,
 * e.g. retrying a completed document or generating from one still processing.
 */
public class DocumentStateException extends CourseAssistantException {

    public DocumentStateException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_DOCUMENT_STATE";
    }
}
