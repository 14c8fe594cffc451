package com.ai.courseassistant.service;

import com.ai.courseassistant.dto.IngestionResult;
import com.ai.courseassistant.exception.ChunkingException;
import com.ai.courseassistant.exception.EmptyDocumentException;
import com.ai.courseassistant.index.EmbeddingIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives one document through extraction, chunking and indexing.
 *
 * <h2>Pipeline</h2>
 * <ol>
 * <li><b>Extract</b> all page text; blank text fails with
 * {@link EmptyDocumentException}.</li>
 * <li><b>Chunk</b> into overlapping windows; zero chunks fails with
 * {@link ChunkingException}.</li>
 * <li><b>Index</b> every chunk with identical document metadata into the
 * document's own collection, replacing whatever an earlier attempt left
 * there.</li>
 * </ol>
 *
 * <p>
 * Status persistence is not done here: the caller records {@code completed}
 * or {@code failed} from the returned result or the thrown
 * {@link com.ai.courseassistant.exception.IngestionException}. Runs for the
 * same document id are serialized; runs for different ids proceed in
 * parallel since their collections are disjoint. A lock lives only while some
 * thread holds or waits for it.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCoordinator {

    private final PdfExtractionService pdfExtractionService;
    private final TextChunker textChunker;
    private final EmbeddingIndex embeddingIndex;

    private final ConcurrentHashMap<String, DocumentLock> documentLocks = new ConcurrentHashMap<>();

    public IngestionResult ingest(Path filePath, String documentId, String filename, String ownerId) {
        return withDocumentLock(documentId, () -> doIngest(filePath, documentId, filename, ownerId));
    }

    /**
     * Runs {@code action} while holding the ingestion lock of {@code documentId}.
     * Callers use this to make "set processing, ingest, set terminal status"
     * one serialized step.
     */
    public <T> T withDocumentLock(String documentId, Supplier<T> action) {
        DocumentLock entry = documentLocks.compute(documentId, (id, existing) -> {
            DocumentLock lock = existing != null ? existing : new DocumentLock();
            lock.users++;
            return lock;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            documentLocks.computeIfPresent(documentId, (id, lock) -> --lock.users == 0 ? null : lock);
        }
    }

    /** Document ids with a thread currently holding or waiting for their lock. */
    int lockedDocumentCount() {
        return documentLocks.size();
    }

    private IngestionResult doIngest(Path filePath, String documentId, String filename, String ownerId) {
        long startTime = System.currentTimeMillis();
        log.info("Ingesting document: id={}, file='{}', owner='{}'", documentId, filename, ownerId);

        // ── Step 1: extract ──────────────────────────────────────────────
        String text = pdfExtractionService.extractText(filePath);
        if (text.isBlank()) {
            throw new EmptyDocumentException(
                    "No readable text found in PDF. The file may contain only images or scanned content.");
        }

        // ── Step 2: chunk ────────────────────────────────────────────────
        List<String> chunks = textChunker.chunk(text);
        if (chunks.isEmpty()) {
            throw new ChunkingException("Failed to split document into chunks");
        }

        // ── Step 3: metadata + index ─────────────────────────────────────
        Map<String, Object> metadata = Map.of(
                EmbeddingIndex.DOCUMENT_ID, documentId,
                EmbeddingIndex.FILENAME, filename,
                EmbeddingIndex.UPLOADED_BY, ownerId);
        List<Map<String, Object>> metadatas = Collections.nCopies(chunks.size(), metadata);

        List<String> ids = embeddingIndex.upsert(documentId, chunks, metadatas);

        log.info("Ingestion complete: id={}, chunks={}, elapsed={}ms",
                documentId, ids.size(), System.currentTimeMillis() - startTime);

        return IngestionResult.builder()
                .documentId(documentId)
                .filename(filename)
                .chunksCreated(chunks.size())
                .storageLocation(embeddingIndex.storageLocation(documentId))
                .build();
    }

    /**
     * A lock plus the number of threads holding or waiting for it. The count is
     * only touched inside {@code compute} calls on the map, so an entry is
     * removed exactly when its last user leaves.
     */
    private static final class DocumentLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
