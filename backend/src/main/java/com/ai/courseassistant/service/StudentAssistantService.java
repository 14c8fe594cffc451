package com.ai.courseassistant.service;

import com.ai.courseassistant.dto.RetrievedContext;
import com.ai.courseassistant.dto.StudentAnswerResponse;
import com.ai.courseassistant.generation.GenerationMode;
import com.ai.courseassistant.generation.GenerationOrchestrator;
import com.ai.courseassistant.generation.GenerationRequest;
import com.ai.courseassistant.generation.PromptCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers student questions, writes study notes and practice sets using
 * Retrieval-Augmented Generation over every completed document.
 *
 * <ol>
 * <li>Retrieve the top-k chunks for the query (k depends on the mode).</li>
 * <li>Generate with the mode's prompt and the retrieved chunks as context.</li>
 * <li>Return the free-text answer with the distinct source filenames.</li>
 * </ol>
 *
 * An empty index still produces an answer; the prompt tells the model to say
 * when the material does not cover the question.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudentAssistantService {

    private final ContextAssembler contextAssembler;
    private final GenerationOrchestrator generationOrchestrator;
    private final PromptCatalog promptCatalog;
    private final ActivityLogService activityLogService;

    public StudentAnswerResponse ask(String userId, String query, GenerationMode mode) {
        if (mode == null) {
            mode = GenerationMode.QA;
        }
        if (mode.isFaculty()) {
            throw new IllegalArgumentException("Mode " + mode.wireName() + " is not available to students");
        }
        log.info("Student request: user='{}', mode={}, query='{}'", userId, mode.wireName(), query);

        // ── Step 1: retrieve the most relevant chunks ────────────────────
        int topK = promptCatalog.get(mode).getTopK();
        RetrievedContext retrieved = contextAssembler.retrieveForQuery(query, topK);

        // ── Step 2: generate from the retrieved context ──────────────────
        String answer = generationOrchestrator.generate(mode, GenerationRequest.builder()
                .context(retrieved.joined())
                .question(query)
                .build());

        activityLogService.logChatInteraction(userId, mode.wireName());

        return StudentAnswerResponse.builder()
                .mode(mode)
                .query(query)
                .answer(answer)
                .sources(retrieved.getSources())
                .chunksUsed(retrieved.getChunks().size())
                .build();
    }
}
