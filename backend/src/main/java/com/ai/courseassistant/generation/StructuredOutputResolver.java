package com.ai.courseassistant.generation;

import com.ai.courseassistant.dto.AssignmentQuestion;
import com.ai.courseassistant.dto.McqQuestion;
import com.ai.courseassistant.dto.VivaQuestion;
import com.ai.courseassistant.model.ContentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw model text into a question list of the requested length.
 *
 * <h2>Algorithm</h2>
 * <ol>
 * <li>Take the text between the first {@code [} and the last {@code ]}.</li>
 * <li>If it parses as exactly one non-empty JSON array, keep its elements unchanged
 * (no schema check), truncating to {@code expectedCount} or topping up with
 * placeholders numbered after the parsed entries.</li>
 * <li>Otherwise synthesize {@code expectedCount} placeholders shaped for the
 * content type.</li>
 * </ol>
 *
 * <p>
 * {@link #resolve} never throws. Placeholder output is visible through
 * {@link ResolvedQuestions#getOrigin()}.
 * </p>
 */
@Slf4j
@Component
public class StructuredOutputResolver {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public StructuredOutputResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // "[...] see [3]" spans two values and must not count as a parsed array
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ResolvedQuestions resolve(String rawText, int expectedCount, ContentType contentType) {
        int count = Math.max(expectedCount, 0);
        List<JsonNode> parsed = parseArray(rawText);

        if (parsed.isEmpty()) {
            log.warn("Model output for {} was not a usable JSON array; synthesizing {} placeholders",
                    contentType.wireName(), count);
            return ResolvedQuestions.builder()
                    .origin(ResolvedQuestions.Origin.SYNTHESIZED)
                    .contentType(contentType)
                    .questions(placeholders(contentType, 1, count))
                    .placeholderCount(count)
                    .build();
        }

        List<JsonNode> questions = new ArrayList<>(parsed.subList(0, Math.min(parsed.size(), count)));
        int missing = count - questions.size();
        if (missing > 0) {
            questions.addAll(placeholders(contentType, questions.size() + 1, missing));
        }

        ResolvedQuestions.Origin origin = parsed.size() == count
                ? ResolvedQuestions.Origin.PARSED
                : ResolvedQuestions.Origin.PADDED;
        if (origin == ResolvedQuestions.Origin.PADDED) {
            log.warn("Model returned {} {} questions, {} requested; adjusted with {} placeholders",
                    parsed.size(), contentType.wireName(), count, Math.max(missing, 0));
        }

        return ResolvedQuestions.builder()
                .origin(origin)
                .contentType(contentType)
                .questions(questions)
                .placeholderCount(Math.max(missing, 0))
                .build();
    }

    private List<JsonNode> parseArray(String rawText) {
        if (rawText == null) {
            return List.of();
        }
        int start = rawText.indexOf('[');
        int end = rawText.lastIndexOf(']');
        if (start == -1 || end <= start) {
            return List.of();
        }

        try {
            JsonNode root = strictReader.readTree(rawText.substring(start, end + 1));
            if (root == null || !root.isArray()) {
                return List.of();
            }
            List<JsonNode> elements = new ArrayList<>(root.size());
            root.forEach(elements::add);
            return elements;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON from model output: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private List<JsonNode> placeholders(ContentType contentType, int firstNumber, int count) {
        List<JsonNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int number = firstNumber + i;
            Object placeholder = switch (contentType) {
                case ASSIGNMENT -> assignmentPlaceholder(number, count, i);
                case MCQ -> mcqPlaceholder(number);
                case VIVA -> vivaPlaceholder(number);
            };
            result.add(objectMapper.valueToTree(placeholder));
        }
        return result;
    }

    private static AssignmentQuestion assignmentPlaceholder(int number, int count, int offset) {
        return AssignmentQuestion.builder()
                .questionNumber(number)
                .question("Question " + number + ": Based on the provided content, explain the key topic with relevant examples.")
                .type(offset % 2 == 0 ? "theory" : "analytical")
                .marks(offset < count / 2 ? 5 : 10)
                .markingScheme("Refer to content for detailed marking")
                .sampleAnswer("Answer should cover key concepts from the provided material")
                .build();
    }

    private static McqQuestion mcqPlaceholder(int number) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String letter : List.of("A", "B", "C", "D")) {
            options.put(letter, "Option " + letter);
        }
        return McqQuestion.builder()
                .questionNumber(number)
                .question("Question " + number + " from content")
                .options(options)
                .correctAnswer("A")
                .explanation("Refer to content for explanation")
                .build();
    }

    private static VivaQuestion vivaPlaceholder(int number) {
        return VivaQuestion.builder()
                .questionNumber(number)
                .question("Explain the concept discussed in the provided content.")
                .type("conceptual")
                .keyPoints(List.of("Key point 1", "Key point 2", "Key point 3"))
                .difficulty("medium")
                .build();
    }
}
