package com.ai.courseassistant.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A chunk as stored in the embedding index: the vector-store id, the chunk
 * text, and the metadata attached at indexing time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexedChunk {

    private String id;

    private String text;

    private Map<String, Object> metadata;

    /** Convenience accessor for a metadata value rendered as text. */
    public String metadataValue(String key) {
        Object value = metadata == null ? null : metadata.get(key);
        return value == null ? null : value.toString();
    }
}
