package com.ai.courseassistant.index;

import com.ai.courseassistant.exception.IndexWriteException;
import com.ai.courseassistant.exception.RetrievalException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link EmbeddingIndex} backed by Spring AI's pgvector {@link VectorStore}.
 *
 * <p>
 * Embedding, insertion, similarity search and deletion go through the
 * VectorStore. Exact metadata reads and counts are plain SQL against the same
 * table because the VectorStore API only offers similarity-ranked reads.
 * A collection is the set of rows whose {@code metadata->>'document_id'}
 * equals the collection id.
 * </p>
 */
@Slf4j
@Component
public class PgVectorEmbeddingIndex implements EmbeddingIndex {

    /** Position of a chunk in its collection; stored for ordered reads, hidden from callers. */
    static final String CHUNK_INDEX = "chunk_index";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final VectorStore vectorStore;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String tableName;

    public PgVectorEmbeddingIndex(VectorStore vectorStore,
                                  JdbcTemplate jdbcTemplate,
                                  ObjectMapper objectMapper,
                                  @Value("${spring.ai.vectorstore.pgvector.table-name:vector_store}") String tableName) {
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid vector table name: " + tableName);
        }
        this.vectorStore = vectorStore;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.tableName = tableName;
    }

    @Override
    public List<String> upsert(String collectionId, List<String> texts, List<Map<String, Object>> metadatas) {
        if (texts.size() != metadatas.size()) {
            throw new IllegalArgumentException("texts and metadatas must have the same size");
        }

        List<Document> documents = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Map<String, Object> metadata = new HashMap<>(metadatas.get(i));
            metadata.put(CHUNK_INDEX, i);
            documents.add(new Document(texts.get(i), metadata));
        }

        try {
            vectorStore.delete(collectionFilter(collectionId));
            vectorStore.add(documents);
        } catch (RuntimeException e) {
            throw new IndexWriteException(
                    "Failed to index " + documents.size() + " chunks for document " + collectionId
                            + ": " + e.getMessage(), e);
        }

        log.info("Indexed {} chunks into collection {}", documents.size(), collectionId);
        return documents.stream().map(Document::getId).collect(Collectors.toList());
    }

    @Override
    public List<IndexedChunk> query(String query, int k) {
        List<Document> results;
        try {
            results = vectorStore.similaritySearch(
                    SearchRequest.builder()
                            .query(query)
                            .topK(k)
                            .build());
        } catch (RuntimeException e) {
            throw new RetrievalException("Similarity search failed: " + e.getMessage(), e);
        }

        // Guard: some VectorStore implementations may return null on no results
        if (results == null) {
            return Collections.emptyList();
        }
        return results.stream()
                .map(d -> IndexedChunk.builder()
                        .id(d.getId())
                        .text(d.getText())
                        .metadata(publicMetadata(d.getMetadata()))
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public List<IndexedChunk> getAll(String collectionId) {
        String sql = "SELECT id::text AS id, content, metadata::text AS metadata FROM " + tableName
                + " WHERE metadata->>'" + DOCUMENT_ID + "' = ?"
                + " ORDER BY COALESCE((metadata->>'" + CHUNK_INDEX + "')::int, 0)";
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> IndexedChunk.builder()
                    .id(rs.getString("id"))
                    .text(rs.getString("content"))
                    .metadata(publicMetadata(readMetadata(rs.getString("metadata"))))
                    .build(), collectionId);
        } catch (DataAccessException e) {
            throw new RetrievalException("Failed to read chunks of document " + collectionId, e);
        }
    }

    @Override
    public void delete(List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        try {
            vectorStore.delete(ids);
        } catch (RuntimeException e) {
            throw new IndexWriteException("Failed to delete " + ids.size() + " vectors", e);
        }
    }

    @Override
    public void deleteCollection(String collectionId) {
        try {
            vectorStore.delete(collectionFilter(collectionId));
        } catch (RuntimeException e) {
            throw new IndexWriteException("Failed to delete vectors of document " + collectionId, e);
        }
        log.info("Deleted vectors for document {}", collectionId);
    }

    @Override
    public long count() {
        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return total == null ? 0 : total;
    }

    @Override
    public long count(String collectionId) {
        Long total = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + tableName + " WHERE metadata->>'" + DOCUMENT_ID + "' = ?",
                Long.class, collectionId);
        return total == null ? 0 : total;
    }

    @Override
    public String storageLocation(String collectionId) {
        return "pgvector:" + tableName + "?" + DOCUMENT_ID + "=" + collectionId;
    }

    private static Filter.Expression collectionFilter(String collectionId) {
        return new FilterExpressionBuilder().eq(DOCUMENT_ID, collectionId).build();
    }

    private static Map<String, Object> publicMetadata(Map<String, Object> stored) {
        Map<String, Object> metadata = new HashMap<>(stored);
        metadata.remove(CHUNK_INDEX);
        metadata.remove("distance"); // added by similarity search
        return metadata;
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable chunk metadata, ignoring: {}", e.getMessage());
            return Map.of();
        }
    }
}
