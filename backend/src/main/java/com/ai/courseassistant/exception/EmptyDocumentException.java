package com.ai.courseassistant.exception;

/** Extraction produced only whitespace, typically a scanned or image-only PDF. */
public class EmptyDocumentException extends IngestionException {

    public EmptyDocumentException(String message) {
        super(message);
    }

    public EmptyDocumentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "EMPTY_DOCUMENT";
    }
}
