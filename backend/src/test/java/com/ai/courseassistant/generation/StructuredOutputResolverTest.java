package com.ai.courseassistant.generation;

import com.ai.courseassistant.model.ContentType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredOutputResolverTest {

    private final StructuredOutputResolver resolver = new StructuredOutputResolver(new ObjectMapper());

    @Test
    @DisplayName("Prose instead of JSON yields well-formed MCQ placeholders")
    void proseFallsBackToMcqPlaceholders() {
        ResolvedQuestions resolved = resolver.resolve(
                "Sure! Here are some questions about the topic you asked for.", 5, ContentType.MCQ);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.SYNTHESIZED);
        assertThat(resolved.isModelOutput()).isFalse();
        assertThat(resolved.getPlaceholderCount()).isEqualTo(5);
        assertThat(resolved.getQuestions()).hasSize(5);
        for (int i = 0; i < 5; i++) {
            JsonNode question = resolved.getQuestions().get(i);
            assertThat(question.get("question_number").asInt()).isEqualTo(i + 1);
            assertThat(fieldNames(question.get("options"))).containsExactlyInAnyOrder("A", "B", "C", "D");
            assertThat(question.get("correct_answer").asText()).isIn("A", "B", "C", "D");
        }
    }

    @Test
    void jsonSurroundedByProseIsExtracted() {
        String raw = "Here you go:\n[{\"question_number\": 1, \"question\": \"What is a tensor?\"},"
                + " {\"question_number\": 2, \"question\": \"Define rank.\"}]\nHope this helps!";

        ResolvedQuestions resolved = resolver.resolve(raw, 2, ContentType.VIVA);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.PARSED);
        assertThat(resolved.getPlaceholderCount()).isZero();
        assertThat(resolved.getQuestions()).extracting(q -> q.get("question").asText())
                .containsExactly("What is a tensor?", "Define rank.");
    }

    @Test
    @DisplayName("Parsed elements are kept as-is without a schema check")
    void parsedElementsAreNotValidated() {
        ResolvedQuestions resolved = resolver.resolve("[{\"foo\": \"bar\"}]", 1, ContentType.ASSIGNMENT);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.PARSED);
        assertThat(resolved.getQuestions().get(0).get("foo").asText()).isEqualTo("bar");
        assertThat(resolved.getQuestions().get(0).has("marks")).isFalse();
    }

    @Test
    void shortOutputIsToppedUpWithContinuedNumbering() {
        String raw = "[{\"question_number\": 1, \"question\": \"Q1\"}, {\"question_number\": 2, \"question\": \"Q2\"}]";

        ResolvedQuestions resolved = resolver.resolve(raw, 4, ContentType.MCQ);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.PADDED);
        assertThat(resolved.isModelOutput()).isTrue();
        assertThat(resolved.getPlaceholderCount()).isEqualTo(2);
        assertThat(resolved.getQuestions()).extracting(q -> q.get("question_number").asInt())
                .containsExactly(1, 2, 3, 4);
        assertThat(resolved.getQuestions().get(2).get("correct_answer").asText()).isEqualTo("A");
    }

    @Test
    void longOutputIsTruncated() {
        String raw = "[{\"n\": 1}, {\"n\": 2}, {\"n\": 3}]";

        ResolvedQuestions resolved = resolver.resolve(raw, 2, ContentType.VIVA);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.PADDED);
        assertThat(resolved.getPlaceholderCount()).isZero();
        assertThat(resolved.getQuestions()).extracting(q -> q.get("n").asInt()).containsExactly(1, 2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "[]", "[1, 2", "no brackets", "] backwards [", "{\"question\": \"not an array\"}",
            "[{\"question_number\": 1, \"question\": \"Q1\"}] See section [3] for details."})
    void unusableOutputAlwaysYieldsRequestedCount(String raw) {
        ResolvedQuestions resolved = resolver.resolve(raw, 3, ContentType.ASSIGNMENT);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.SYNTHESIZED);
        assertThat(resolved.getQuestions()).hasSize(3);
    }

    @Test
    @DisplayName("A bracket span holding an array followed by more text is not valid JSON")
    void trailingTextAfterArrayIsRejected() {
        ResolvedQuestions resolved = resolver.resolve(
                "[{\"question_number\": 1, \"question\": \"Q1\"}] See section [3] for details.", 1, ContentType.VIVA);

        assertThat(resolved.getOrigin()).isEqualTo(ResolvedQuestions.Origin.SYNTHESIZED);
        assertThat(resolved.getQuestions().get(0).get("question").asText())
                .isEqualTo("Explain the concept discussed in the provided content.");
    }

    @Test
    void nullOutputIsHandled() {
        assertThat(resolver.resolve(null, 2, ContentType.VIVA).getQuestions()).hasSize(2);
    }

    @ParameterizedTest
    @EnumSource(ContentType.class)
    void zeroRequestedGivesEmptyList(ContentType contentType) {
        assertThat(resolver.resolve("[{\"a\": 1}]", 0, contentType).getQuestions()).isEmpty();
        assertThat(resolver.resolve("garbage", 0, contentType).getQuestions()).isEmpty();
    }

    @Test
    void assignmentPlaceholdersAlternateTypeAndRaiseMarks() {
        ResolvedQuestions resolved = resolver.resolve("not json", 4, ContentType.ASSIGNMENT);

        assertThat(resolved.getQuestions()).extracting(q -> q.get("type").asText())
                .containsExactly("theory", "analytical", "theory", "analytical");
        assertThat(resolved.getQuestions()).extracting(q -> q.get("marks").asInt())
                .containsExactly(5, 5, 10, 10);
        assertThat(resolved.getQuestions()).allMatch(q -> q.has("marking_scheme") && q.has("sample_answer"));
    }

    @Test
    void vivaPlaceholdersCarryThreeKeyPoints() {
        ResolvedQuestions resolved = resolver.resolve("not json", 2, ContentType.VIVA);

        assertThat(resolved.getQuestions()).allSatisfy(q -> {
            assertThat(q.get("key_points").size()).isEqualTo(3);
            assertThat(q.get("difficulty").asText()).isEqualTo("medium");
        });
    }

    private static Set<String> fieldNames(JsonNode node) {
        return StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .collect(Collectors.toSet());
    }
}
