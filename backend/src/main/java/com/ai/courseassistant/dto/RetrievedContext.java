package com.ai.courseassistant.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Chunks found by a similarity query plus the distinct files they came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedContext {

    /** Chunk texts, most relevant first. */
    private List<String> chunks;

    /** Distinct source filenames in first-seen order. */
    private List<String> sources;

    public boolean isEmpty() {
        return chunks == null || chunks.isEmpty();
    }

    /** Chunks joined into a single prompt context block. */
    public String joined() {
        return isEmpty() ? "" : String.join("\n\n", chunks);
    }
}
