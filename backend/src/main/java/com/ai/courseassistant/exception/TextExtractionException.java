package com.ai.courseassistant.exception;

/** The PDF could not be opened or read. */
public class TextExtractionException extends IngestionException {

    public TextExtractionException(String message) {
        super(message);
    }

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "TEXT_EXTRACTION_FAILED";
    }
}
