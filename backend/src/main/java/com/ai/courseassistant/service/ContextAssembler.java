package com.ai.courseassistant.service;

import com.ai.courseassistant.config.CourseAssistantProperties;
import com.ai.courseassistant.dto.RetrievedContext;
import com.ai.courseassistant.index.EmbeddingIndex;
import com.ai.courseassistant.index.IndexedChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the context handed to the generative model.
 *
 * <ul>
 * <li>{@link #retrieveForQuery} ranks chunks from every indexed document by
 * similarity to a question (student modes).</li>
 * <li>{@link #retrieveForDocuments} concatenates the chunks of explicitly
 * chosen documents in document-then-chunk order (faculty modes).</li>
 * </ul>
 *
 * Finding nothing is not an error: both return an empty result and the
 * caller generates from empty context.
 */
@Slf4j
@Service
public class ContextAssembler {

    private final EmbeddingIndex embeddingIndex;
    private final int documentChunkCap;

    public ContextAssembler(EmbeddingIndex embeddingIndex, CourseAssistantProperties properties) {
        this.embeddingIndex = embeddingIndex;
        this.documentChunkCap = properties.getRetrieval().getDocumentChunkCap();
    }

    public RetrievedContext retrieveForQuery(String query, int k) {
        List<IndexedChunk> hits = embeddingIndex.query(query, k);

        if (hits.isEmpty()) {
            log.warn("No relevant chunks found in the index for query='{}'", query);
        }

        List<String> chunks = hits.stream()
                .map(IndexedChunk::getText)
                .collect(Collectors.toList());

        Set<String> sources = hits.stream()
                .map(hit -> hit.metadataValue(EmbeddingIndex.FILENAME))
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        log.debug("Retrieved {} chunks from {} sources (k={})", chunks.size(), sources.size(), k);
        return RetrievedContext.builder()
                .chunks(chunks)
                .sources(new ArrayList<>(sources))
                .build();
    }

    /**
     * Concatenates the chunks of the given documents, blank-line separated,
     * keeping only the first {@code documentChunkCap} chunks overall.
     *
     * @return the context, or an empty string when none of the documents has chunks
     */
    public String retrieveForDocuments(List<String> documentIds) {
        List<String> collected = new ArrayList<>();

        for (String documentId : documentIds) {
            if (collected.size() >= documentChunkCap) {
                break;
            }
            for (IndexedChunk chunk : embeddingIndex.getAll(documentId)) {
                if (collected.size() >= documentChunkCap) {
                    break;
                }
                collected.add(chunk.getText());
            }
        }

        if (collected.isEmpty()) {
            log.warn("No chunks found for documents {}", documentIds);
            return "";
        }

        log.debug("Assembled context from {} chunks across {} documents", collected.size(), documentIds.size());
        return String.join("\n\n", collected);
    }
}
