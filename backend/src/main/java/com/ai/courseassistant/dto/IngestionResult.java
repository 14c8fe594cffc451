package com.ai.courseassistant.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one successful ingestion run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private String documentId;

    private String filename;

    /** Number of chunks embedded and stored for the document. */
    private int chunksCreated;

    /** Where the document's vectors live, see EmbeddingIndex#storageLocation. */
    private String storageLocation;
}
