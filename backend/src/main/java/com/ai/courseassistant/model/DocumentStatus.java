package com.ai.courseassistant.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an uploaded document. {@code COMPLETED} and {@code FAILED} are
 * terminal; the only way out of {@code FAILED} is an explicit retry.
 */
public enum DocumentStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(DocumentStatus next) {
        return switch (this) {
            case QUEUED, FAILED -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
