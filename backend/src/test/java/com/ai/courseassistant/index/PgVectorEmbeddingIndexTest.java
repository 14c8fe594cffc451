package com.ai.courseassistant.index;

import com.ai.courseassistant.exception.IndexWriteException;
import com.ai.courseassistant.exception.RetrievalException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PgVectorEmbeddingIndexTest {

    @Mock
    private VectorStore vectorStore;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgVectorEmbeddingIndex index;

    @BeforeEach
    void setUp() {
        index = new PgVectorEmbeddingIndex(vectorStore, jdbcTemplate, new ObjectMapper(), "vector_store");
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertReplacesTheWholeCollection() {
        Map<String, Object> metadata = Map.of(EmbeddingIndex.DOCUMENT_ID, "doc-1", EmbeddingIndex.FILENAME, "a.pdf");

        List<String> ids = index.upsert("doc-1", List.of("first", "second"), List.of(metadata, metadata));

        InOrder order = inOrder(vectorStore);
        ArgumentCaptor<Filter.Expression> filter = ArgumentCaptor.forClass(Filter.Expression.class);
        order.verify(vectorStore).delete(filter.capture());
        ArgumentCaptor<List<Document>> added = ArgumentCaptor.forClass(List.class);
        order.verify(vectorStore).add(added.capture());

        assertThat(filter.getValue())
                .isEqualTo(new FilterExpressionBuilder().eq(EmbeddingIndex.DOCUMENT_ID, "doc-1").build());
        assertThat(added.getValue()).extracting(Document::getText).containsExactly("first", "second");
        assertThat(added.getValue().get(1).getMetadata())
                .containsEntry(EmbeddingIndex.DOCUMENT_ID, "doc-1")
                .containsEntry(PgVectorEmbeddingIndex.CHUNK_INDEX, 1);
        assertThat(ids).hasSize(2).doesNotHaveDuplicates();
    }

    @Test
    void upsertRejectsMismatchedSizes() {
        assertThatThrownBy(() -> index.upsert("doc-1", List.of("a", "b"), List.of(Map.of())))
                .isInstanceOf(IllegalArgumentException.class);
        verify(vectorStore, never()).add(anyList());
    }

    @Test
    void writeFailureIsWrapped() {
        doThrow(new IllegalStateException("embedding model offline")).when(vectorStore).add(anyList());

        assertThatThrownBy(() -> index.upsert("doc-1", List.of("a"), List.of(Map.of())))
                .isInstanceOf(IndexWriteException.class)
                .hasMessageContaining("doc-1")
                .hasMessageContaining("embedding model offline");
    }

    @Test
    void queryHidesInternalMetadata() {
        Document hit = new Document("id-1", "chunk text", Map.of(
                EmbeddingIndex.DOCUMENT_ID, "doc-1",
                EmbeddingIndex.FILENAME, "a.pdf",
                PgVectorEmbeddingIndex.CHUNK_INDEX, 0,
                "distance", 0.12));
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(hit));

        List<IndexedChunk> chunks = index.query("question", 5);

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(request.capture());
        assertThat(request.getValue().getTopK()).isEqualTo(5);
        assertThat(request.getValue().getQuery()).isEqualTo("question");
        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.getText()).isEqualTo("chunk text");
            assertThat(chunk.getMetadata()).containsOnlyKeys(EmbeddingIndex.DOCUMENT_ID, EmbeddingIndex.FILENAME);
        });
    }

    @Test
    void queryFailureBecomesRetrievalException() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenThrow(new IllegalStateException("down"));

        assertThatThrownBy(() -> index.query("q", 3)).isInstanceOf(RetrievalException.class);
    }

    @Test
    void countsAreScopedByDocumentId() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), eq("doc-1"))).thenReturn(4L);

        assertThat(index.count("doc-1")).isEqualTo(4);
        verify(jdbcTemplate).queryForObject(
                eq("SELECT COUNT(*) FROM vector_store WHERE metadata->>'document_id' = ?"), eq(Long.class), eq("doc-1"));
    }

    @Test
    void storageLocationNamesTableAndDocument() {
        assertThat(index.storageLocation("doc-9")).isEqualTo("pgvector:vector_store?document_id=doc-9");
    }

    @Test
    void unsafeTableNameIsRejected() {
        assertThatThrownBy(() -> new PgVectorEmbeddingIndex(vectorStore, jdbcTemplate, new ObjectMapper(),
                "vector_store; DROP TABLE documents"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
