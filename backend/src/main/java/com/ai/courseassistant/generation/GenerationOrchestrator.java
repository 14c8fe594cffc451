package com.ai.courseassistant.generation;

import com.ai.courseassistant.client.LlmClient;
import com.ai.courseassistant.config.CourseAssistantProperties;
import com.ai.courseassistant.exception.GenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders the prompt for a mode and makes exactly one model call.
 *
 * <p>
 * Faculty modes see at most {@code facultyContextChars} characters of
 * context; student modes get the assembled context untouched. Model failures
 * are not retried and surface as {@link GenerationException}.
 * </p>
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private final PromptCatalog promptCatalog;
    private final LlmClient llmClient;
    private final int facultyContextChars;

    public GenerationOrchestrator(PromptCatalog promptCatalog,
                                  LlmClient llmClient,
                                  CourseAssistantProperties properties) {
        this.promptCatalog = promptCatalog;
        this.llmClient = llmClient;
        this.facultyContextChars = properties.getGeneration().getFacultyContextChars();
    }

    public String generate(GenerationMode mode, GenerationRequest request) {
        PromptSpec spec = promptCatalog.get(mode);
        String prompt = spec.render(slotValues(mode, request));

        log.info("Generating: mode={}, promptChars={}", mode.wireName(), prompt.length());
        long startTime = System.currentTimeMillis();

        String raw;
        try {
            raw = llmClient.complete(prompt, spec.getTemperature(), spec.getMaxTokens());
        } catch (RuntimeException e) {
            log.error("Model invocation failed for mode={}: {}", mode.wireName(), e.getMessage(), e);
            throw new GenerationException("Model invocation failed for mode " + mode.wireName()
                    + ": " + e.getMessage(), e);
        }

        log.info("Generation complete: mode={}, responseChars={}, elapsed={}ms",
                mode.wireName(), raw.length(), System.currentTimeMillis() - startTime);
        return raw;
    }

    private Map<String, Object> slotValues(GenerationMode mode, GenerationRequest request) {
        String context = request.getContext() == null ? "" : request.getContext();

        Map<String, Object> values = new HashMap<>();
        if (mode.isFaculty()) {
            values.put(PromptCatalog.CONTEXT, truncate(context, facultyContextChars));
            values.put(PromptCatalog.NUM_QUESTIONS, request.getNumQuestions());
            values.put(PromptCatalog.DIFFICULTY, request.getDifficulty() == null ? "medium" : request.getDifficulty());
        } else {
            values.put(PromptCatalog.CONTEXT, context);
            values.put(PromptCatalog.QUESTION, request.getQuestion() == null ? "" : request.getQuestion());
        }
        return values;
    }

    private static String truncate(String text, int maxChars) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
