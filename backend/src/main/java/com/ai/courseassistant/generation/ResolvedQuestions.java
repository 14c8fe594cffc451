package com.ai.courseassistant.generation;

import com.ai.courseassistant.model.ContentType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Question list produced by {@link StructuredOutputResolver}, tagged with
 * where its entries came from.
 */
@Value
@Builder
public class ResolvedQuestions {

    public enum Origin {
        /** Model output parsed and had exactly the requested number of entries. */
        PARSED,
        /** Model output parsed but was truncated or topped up with placeholders. */
        PADDED,
        /** Model output unusable; every entry is a placeholder. */
        SYNTHESIZED
    }

    Origin origin;

    ContentType contentType;

    List<JsonNode> questions;

    /** Entries that are placeholders rather than model output. */
    int placeholderCount;

    public boolean isModelOutput() {
        return origin != Origin.SYNTHESIZED;
    }
}
