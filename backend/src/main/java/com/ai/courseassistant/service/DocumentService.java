package com.ai.courseassistant.service;

import com.ai.courseassistant.config.CourseAssistantProperties;
import com.ai.courseassistant.dto.DocumentResponse;
import com.ai.courseassistant.dto.IngestionResult;
import com.ai.courseassistant.exception.DocumentNotFoundException;
import com.ai.courseassistant.exception.DocumentStateException;
import com.ai.courseassistant.exception.IngestionException;
import com.ai.courseassistant.index.EmbeddingIndex;
import com.ai.courseassistant.model.CourseDocument;
import com.ai.courseassistant.model.DocumentStatus;
import com.ai.courseassistant.repository.CourseDocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * DocumentService owns the document lifecycle:
 * upload → {@code queued} → {@code processing} → {@code completed | failed}.
 *
 * <p>
 * Ingestion runs inline; the upload call returns once the document has
 * reached a terminal state. An ingestion failure is recorded on the document
 * and then rethrown so the caller sees it too.
 * </p>
 */
@Slf4j
@Service
public class DocumentService {

    private final CourseDocumentRepository documentRepository;
    private final IngestionCoordinator ingestionCoordinator;
    private final EmbeddingIndex embeddingIndex;
    private final LocalFileStorageService fileStorageService;
    private final ActivityLogService activityLogService;
    private final long maxFileSizeBytes;

    public DocumentService(CourseDocumentRepository documentRepository,
                           IngestionCoordinator ingestionCoordinator,
                           EmbeddingIndex embeddingIndex,
                           LocalFileStorageService fileStorageService,
                           ActivityLogService activityLogService,
                           CourseAssistantProperties properties) {
        this.documentRepository = documentRepository;
        this.ingestionCoordinator = ingestionCoordinator;
        this.embeddingIndex = embeddingIndex;
        this.fileStorageService = fileStorageService;
        this.activityLogService = activityLogService;
        this.maxFileSizeBytes = properties.getStorage().getMaxFileSizeBytes();
    }

    // ── Upload & ingest ───────────────────────────────────────────────────

    public DocumentResponse upload(MultipartFile file, String courseName, String ownerId) throws IOException {
        validateFile(file);
        String filename = file.getOriginalFilename();

        try (InputStream content = file.getInputStream()) {
            return upload(content, filename, courseName, ownerId);
        }
    }

    /**
     * Stores the file, creates the {@code queued} record and ingests it.
     *
     * @throws IngestionException after the document has been marked {@code failed}
     * @throws IOException if the file cannot be stored
     */
    public DocumentResponse upload(InputStream content, String filename, String courseName, String ownerId)
            throws IOException {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }

        String documentId = UUID.randomUUID().toString();
        Path stored = fileStorageService.save(documentId, filename, content);

        CourseDocument document = documentRepository.save(CourseDocument.builder()
                .id(documentId)
                .filename(filename)
                .filePath(stored.toString())
                .uploadedBy(ownerId)
                .courseName(courseName)
                .status(DocumentStatus.QUEUED)
                .build());
        log.info("Document queued: id={}, file='{}', course='{}', owner='{}'",
                documentId, filename, courseName, ownerId);

        return DocumentResponse.from(process(document));
    }

    /**
     * Re-runs ingestion for a {@code failed} document. The document's index
     * collection is replaced, not appended to.
     */
    public DocumentResponse retry(String documentId) {
        CourseDocument document = findDocument(documentId);
        if (document.getStatus() != DocumentStatus.FAILED) {
            throw new DocumentStateException("Only failed documents can be retried; document "
                    + documentId + " is " + document.getStatus().wireName());
        }
        log.info("Retrying ingestion for document {}", documentId);
        return DocumentResponse.from(process(document));
    }

    private CourseDocument process(CourseDocument queued) {
        return ingestionCoordinator.withDocumentLock(queued.getId(), () -> {
            CourseDocument document = transition(findDocument(queued.getId()), DocumentStatus.PROCESSING);
            document.setErrorMessage(null);
            document = documentRepository.save(document);

            IngestionResult result;
            try {
                result = ingestionCoordinator.ingest(
                        Paths.get(document.getFilePath()),
                        document.getId(),
                        document.getFilename(),
                        document.getUploadedBy());
            } catch (RuntimeException e) {
                // every stage failure ends in the terminal failed state, with the reason kept
                transition(document, DocumentStatus.FAILED);
                document.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                documentRepository.save(document);
                log.error("Document {} failed: {}", document.getId(), document.getErrorMessage());
                throw e;
            }

            transition(document, DocumentStatus.COMPLETED);
            document.setChunkCount(result.getChunksCreated());
            document = documentRepository.save(document);
            log.info("Document {} completed with {} chunks at {}",
                    document.getId(), result.getChunksCreated(), result.getStorageLocation());

            activityLogService.logDocumentProcessed(document.getUploadedBy(), document.getId(),
                    result.getChunksCreated());
            return document;
        });
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public DocumentResponse get(String documentId) {
        return DocumentResponse.from(findDocument(documentId));
    }

    public List<DocumentResponse> listByOwner(String ownerId) {
        return documentRepository.findByUploadedByOrderByCreatedAtDesc(ownerId)
                .stream()
                .map(DocumentResponse::from)
                .collect(Collectors.toList());
    }

    public List<DocumentResponse> listCompleted() {
        return documentRepository.findByStatusOrderByCreatedAtDesc(DocumentStatus.COMPLETED)
                .stream()
                .map(DocumentResponse::from)
                .collect(Collectors.toList());
    }

    public CourseDocument findDocument(String documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document", documentId));
    }

    // ── Delete ────────────────────────────────────────────────────────────

    /**
     * Removes the document's vectors, its stored file and its record. Vectors
     * go first so a failure there leaves the record in place for another try.
     */
    public void delete(String documentId) {
        ingestionCoordinator.withDocumentLock(documentId, () -> {
            CourseDocument document = findDocument(documentId);
            embeddingIndex.deleteCollection(documentId);
            fileStorageService.delete(document.getFilePath());
            documentRepository.delete(document);
            log.info("Document deleted: id={}, file='{}'", documentId, document.getFilename());
            return null;
        });
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static CourseDocument transition(CourseDocument document, DocumentStatus next) {
        if (!document.getStatus().canTransitionTo(next)) {
            throw new DocumentStateException("Document " + document.getId() + " cannot move from "
                    + document.getStatus().wireName() + " to " + next.wireName());
        }
        document.setStatus(next);
        return document;
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty. Please select a valid PDF.");
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".pdf")) {
            throw new IllegalArgumentException("Only PDF files are supported. Received: " + originalFilename);
        }

        if (file.getSize() > maxFileSizeBytes) {
            throw new IllegalArgumentException("File size exceeds " + (maxFileSizeBytes / 1024 / 1024)
                    + "MB limit. File size: " + (file.getSize() / 1024 / 1024) + "MB");
        }

        String contentType = file.getContentType();
        if (contentType != null && !contentType.equals("application/pdf")) {
            log.warn("Unexpected content type: {}. Proceeding with filename-based validation.", contentType);
        }
    }
}
