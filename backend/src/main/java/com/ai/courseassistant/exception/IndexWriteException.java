package com.ai.courseassistant.exception;

/** Embedding or persisting chunks into the vector index failed. */
public class IndexWriteException extends IngestionException {

    public IndexWriteException(String message) {
        super(message);
    }

    public IndexWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "INDEX_WRITE_FAILED";
    }
}
