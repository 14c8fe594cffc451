package com.ai.courseassistant.index;

import java.util.List;
import java.util.Map;

/**
 * Persistent vector index over course material.
 *
 * <p>
 * Entries are grouped into collections, one per document id, so that a
 * document's vectors can be replaced or removed without touching anyone
 * else's. Similarity search always runs across every collection.
 * </p>
 */
public interface EmbeddingIndex {

    /** Metadata key holding the owning document id (the collection id). */
    String DOCUMENT_ID = "document_id";
    String FILENAME = "filename";
    String UPLOADED_BY = "uploaded_by";

    /**
     * Embeds {@code texts} and stores them as the complete contents of the
     * collection, in list order. Any entries previously stored under the same
     * collection id are removed first.
     *
     * @return the system-generated ids of the new entries
     * @throws com.ai.courseassistant.exception.IndexWriteException on embedding or store failure
     */
    List<String> upsert(String collectionId, List<String> texts, List<Map<String, Object>> metadatas);

    /**
     * Approximate nearest-neighbour search across all collections, most
     * similar first.
     *
     * @throws com.ai.courseassistant.exception.RetrievalException on query failure
     */
    List<IndexedChunk> query(String query, int k);

    /**
     * Every entry of a collection in chunk order, by exact metadata match.
     *
     * @throws com.ai.courseassistant.exception.RetrievalException on query failure
     */
    List<IndexedChunk> getAll(String collectionId);

    void delete(List<String> ids);

    /** Removes every entry of the collection. */
    void deleteCollection(String collectionId);

    long count();

    long count(String collectionId);

    /** Human-readable handle describing where a collection lives. */
    String storageLocation(String collectionId);
}
