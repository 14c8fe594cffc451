package com.ai.courseassistant.service;

import com.ai.courseassistant.config.CourseAssistantProperties;
import com.ai.courseassistant.dto.ContentGenerationRequest;
import com.ai.courseassistant.dto.GeneratedContentResponse;
import com.ai.courseassistant.exception.DocumentNotFoundException;
import com.ai.courseassistant.exception.DocumentStateException;
import com.ai.courseassistant.generation.GenerationMode;
import com.ai.courseassistant.generation.GenerationOrchestrator;
import com.ai.courseassistant.generation.GenerationRequest;
import com.ai.courseassistant.generation.ResolvedQuestions;
import com.ai.courseassistant.generation.StructuredOutputResolver;
import com.ai.courseassistant.model.ContentType;
import com.ai.courseassistant.model.CourseDocument;
import com.ai.courseassistant.model.DocumentStatus;
import com.ai.courseassistant.model.GeneratedContent;
import com.ai.courseassistant.repository.GeneratedContentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ContentGenerationService produces assignments, MCQ sets and viva questions
 * from documents a faculty member selects, and stores each result as an
 * immutable record.
 *
 * <p>
 * Only a failed model call fails the request. Unparseable model output is
 * replaced by placeholders (see {@link StructuredOutputResolver}) and the
 * stored record says so in its {@code origin}.
 * </p>
 */
@Slf4j
@Service
public class ContentGenerationService {

    private static final Set<String> DIFFICULTIES = Set.of("easy", "medium", "hard");

    private final DocumentService documentService;
    private final ContextAssembler contextAssembler;
    private final GenerationOrchestrator generationOrchestrator;
    private final StructuredOutputResolver structuredOutputResolver;
    private final GeneratedContentRepository generatedContentRepository;
    private final ActivityLogService activityLogService;
    private final ObjectMapper objectMapper;
    private final int maxQuestions;

    public ContentGenerationService(DocumentService documentService,
                                    ContextAssembler contextAssembler,
                                    GenerationOrchestrator generationOrchestrator,
                                    StructuredOutputResolver structuredOutputResolver,
                                    GeneratedContentRepository generatedContentRepository,
                                    ActivityLogService activityLogService,
                                    ObjectMapper objectMapper,
                                    CourseAssistantProperties properties) {
        this.documentService = documentService;
        this.contextAssembler = contextAssembler;
        this.generationOrchestrator = generationOrchestrator;
        this.structuredOutputResolver = structuredOutputResolver;
        this.generatedContentRepository = generatedContentRepository;
        this.activityLogService = activityLogService;
        this.objectMapper = objectMapper;
        this.maxQuestions = properties.getGeneration().getMaxQuestions();
    }

    // ── Generate ─────────────────────────────────────────────────────────

    public GeneratedContentResponse generate(ContentGenerationRequest request) {
        ContentType contentType = request.getContentType();
        List<String> documentIds = request.getDocumentIds();
        if (documentIds == null || documentIds.isEmpty()) {
            throw new IllegalArgumentException("Select at least one document to generate content from");
        }
        requireCompleted(documentIds);

        int numQuestions = clampQuestionCount(request.getNumQuestions(), contentType);
        String difficulty = normalizeDifficulty(request.getDifficulty());

        log.info("Generating {} {} questions for faculty='{}' from documents {}",
                numQuestions, contentType.wireName(), request.getFacultyId(), documentIds);

        // ── Step 1: assemble context from the selected documents ─────────
        String context = contextAssembler.retrieveForDocuments(documentIds);
        if (context.isEmpty()) {
            log.warn("Generating {} without context; selected documents have no indexed chunks",
                    contentType.wireName());
        }

        // ── Step 2: one model call ───────────────────────────────────────
        String raw = generationOrchestrator.generate(GenerationMode.forContentType(contentType),
                GenerationRequest.builder()
                        .context(context)
                        .numQuestions(numQuestions)
                        .difficulty(difficulty)
                        .build());

        // ── Step 3: resolve to well-formed questions ─────────────────────
        ResolvedQuestions resolved = structuredOutputResolver.resolve(raw, numQuestions, contentType);

        // ── Step 4: persist immutable record ─────────────────────────────
        GeneratedContent saved = generatedContentRepository.save(GeneratedContent.builder()
                .contentType(contentType)
                .facultyId(request.getFacultyId())
                .documentIds(String.join(",", documentIds))
                .questionsJson(toJson(resolved.getQuestions()))
                .origin(resolved.getOrigin().name())
                .build());

        log.info("Stored generated content id={}, type={}, questions={}, origin={}",
                saved.getId(), contentType.wireName(), resolved.getQuestions().size(), resolved.getOrigin());

        activityLogService.logContentGeneration(request.getFacultyId(), contentType.wireName(),
                resolved.getQuestions().size());

        return toResponse(saved, resolved.getQuestions());
    }

    // ── History ──────────────────────────────────────────────────────────

    public List<GeneratedContentResponse> listByFaculty(String facultyId) {
        return generatedContentRepository.findByFacultyIdOrderByCreatedAtDesc(facultyId)
                .stream()
                .map(content -> toResponse(content, fromJson(content.getQuestionsJson())))
                .collect(Collectors.toList());
    }

    public GeneratedContentResponse get(String contentId) {
        GeneratedContent content = generatedContentRepository.findById(contentId)
                .orElseThrow(() -> new DocumentNotFoundException("Generated content", contentId));
        return toResponse(content, fromJson(content.getQuestionsJson()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private void requireCompleted(List<String> documentIds) {
        for (String documentId : documentIds) {
            CourseDocument document = documentService.findDocument(documentId);
            if (document.getStatus() != DocumentStatus.COMPLETED) {
                throw new DocumentStateException("Document " + documentId + " is "
                        + document.getStatus().wireName() + "; only completed documents can be used");
            }
        }
    }

    private int clampQuestionCount(Integer requested, ContentType contentType) {
        if (requested == null) {
            return contentType.getDefaultQuestionCount();
        }
        return Math.max(1, Math.min(requested, maxQuestions));
    }

    private static String normalizeDifficulty(String difficulty) {
        if (difficulty == null || difficulty.isBlank()) {
            return "medium";
        }
        String normalized = difficulty.trim().toLowerCase();
        if (!DIFFICULTIES.contains(normalized)) {
            throw new IllegalArgumentException("difficulty must be one of easy, medium, hard");
        }
        return normalized;
    }

    private GeneratedContentResponse toResponse(GeneratedContent content, List<JsonNode> questions) {
        return GeneratedContentResponse.builder()
                .contentId(content.getId())
                .contentType(content.getContentType())
                .facultyId(content.getFacultyId())
                .documentIds(Arrays.asList(content.getDocumentIds().split(",")))
                .questions(questions)
                .totalQuestions(questions.size())
                .origin(content.getOrigin())
                .createdAt(content.getCreatedAt())
                .build();
    }

    private String toJson(List<JsonNode> questions) {
        try {
            return objectMapper.writeValueAsString(questions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize generated questions", e);
        }
    }

    private List<JsonNode> fromJson(String json) {
        try {
            List<JsonNode> questions = new ArrayList<>();
            objectMapper.readTree(json).forEach(questions::add);
            return questions;
        } catch (JsonProcessingException e) {
            log.warn("Stored questions are not valid JSON: {}", e.getMessage());
            return List.of();
        }
    }
}
