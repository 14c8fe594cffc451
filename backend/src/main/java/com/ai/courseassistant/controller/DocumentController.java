package com.ai.courseassistant.controller;

import com.ai.courseassistant.dto.DocumentResponse;
import com.ai.courseassistant.service.DocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * DocumentController exposes REST endpoints for course material upload,
 * listing, ingestion retry and deletion.
 */
@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class DocumentController {

    private final DocumentService documentService;

    /**
     * Uploads a PDF and ingests it before responding. A failed ingestion is
     * answered by the exception handler with the recorded error message.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam("courseName") String courseName,
            @RequestParam("ownerId") String ownerId) throws IOException {

        log.info("Received upload: file='{}', size={}KB, course='{}', owner='{}'",
                file.getOriginalFilename(), file.getSize() / 1024, courseName, ownerId);

        DocumentResponse response = documentService.upload(file, courseName, ownerId);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<DocumentResponse>> list(@RequestParam(value = "ownerId", required = false) String ownerId) {
        if (ownerId == null) {
            return ResponseEntity.ok(documentService.listCompleted());
        }
        return ResponseEntity.ok(documentService.listByOwner(ownerId));
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentResponse> get(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.get(documentId));
    }

    @PostMapping("/{documentId}/retry")
    public ResponseEntity<DocumentResponse> retry(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.retry(documentId));
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String documentId) {
        documentService.delete(documentId);
        return ResponseEntity.ok(Map.of("message", "Document deleted successfully", "documentId", documentId));
    }
}
