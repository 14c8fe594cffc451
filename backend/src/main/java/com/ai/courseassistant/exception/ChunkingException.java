package com.ai.courseassistant.exception;

/** Chunking yielded no chunks for non-blank text. */
public class ChunkingException extends IngestionException {

    public ChunkingException(String message) {
        super(message);
    }

    public ChunkingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CHUNKING_FAILED";
    }
}
