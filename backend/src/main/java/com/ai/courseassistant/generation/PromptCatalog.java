package com.ai.courseassistant.generation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Prompt table keyed by {@link GenerationMode}. Built and validated once when
 * the bean is created; a mode without a template, or a template that does not
 * reference exactly its declared slots, fails startup.
 */
@Slf4j
@Component
public class PromptCatalog {

    public static final String CONTEXT = "context";
    public static final String QUESTION = "question";
    public static final String NUM_QUESTIONS = "num_questions";
    public static final String DIFFICULTY = "difficulty";

    private static final double STUDENT_TEMPERATURE = 0.3;
    private static final int STUDENT_MAX_TOKENS = 1024;
    private static final double FACULTY_TEMPERATURE = 0.5;
    private static final int FACULTY_MAX_TOKENS = 2048;

    private final Map<GenerationMode, PromptSpec> specs;

    public PromptCatalog() {
        this(defaultSpecs());
    }

    PromptCatalog(Map<GenerationMode, PromptSpec> specs) {
        validate(specs);
        this.specs = Collections.unmodifiableMap(new EnumMap<>(specs));
        log.info("Prompt catalog loaded with {} modes", this.specs.size());
    }

    public PromptSpec get(GenerationMode mode) {
        return specs.get(mode);
    }

    static void validate(Map<GenerationMode, PromptSpec> specs) {
        for (GenerationMode mode : GenerationMode.values()) {
            PromptSpec spec = specs.get(mode);
            if (spec == null) {
                throw new IllegalStateException("No prompt template configured for mode " + mode.wireName());
            }
            if (!spec.getRequiredSlots().contains(CONTEXT)) {
                throw new IllegalStateException("Template for " + mode.wireName() + " must take a context slot");
            }
            Set<String> referenced = spec.referencedSlots();
            if (!referenced.equals(spec.getRequiredSlots())) {
                throw new IllegalStateException("Template for " + mode.wireName()
                        + " references slots " + referenced + " but declares " + spec.getRequiredSlots());
            }
            if (mode.isFaculty() == (spec.getTopK() > 0)) {
                throw new IllegalStateException("topK must be set for student modes only, check " + mode.wireName());
            }
            if (spec.getMaxTokens() <= 0) {
                throw new IllegalStateException("maxTokens must be positive for " + mode.wireName());
            }
        }
    }

    private static Map<GenerationMode, PromptSpec> defaultSpecs() {
        Map<GenerationMode, PromptSpec> specs = new EnumMap<>(GenerationMode.class);

        specs.put(GenerationMode.QA, studentSpec(5, """
                You are a helpful teaching assistant. Use the following course material to answer the question.
                If you don't know the answer based on the material, say so clearly.

                --- COURSE MATERIAL ---
                {context}
                --- END OF COURSE MATERIAL ---

                QUESTION: {question}

                ANSWER: Provide a clear, concise answer with examples where appropriate.
                """));

        specs.put(GenerationMode.NOTES, studentSpec(7, """
                Using the provided course material, create detailed study notes on: {question}

                Format your response as follows:

                **KEY CONCEPTS:**
                - [List main concepts with brief definitions]

                **DETAILED EXPLANATION:**
                [Provide comprehensive explanation with examples]

                **IMPORTANT POINTS TO REMEMBER:**
                - [Highlight critical information]

                **PRACTICE QUESTIONS:**
                1. [Conceptual question with answer]
                2. [Application question with answer]
                3. [Analysis question with answer]

                --- COURSE MATERIAL ---
                {context}
                --- END OF COURSE MATERIAL ---

                Generate comprehensive study notes now:
                """));

        specs.put(GenerationMode.PRACTICE, studentSpec(6, """
                Based on the course material provided, generate practice questions about: {question}

                Create a mix of question types:

                **MULTIPLE CHOICE QUESTIONS (3 questions):**
                [Each with 4 options and the correct answer marked]

                **SHORT ANSWER QUESTIONS (3 questions):**
                [With brief model answers]

                **CONCEPTUAL QUESTIONS (2 questions):**
                [Deeper understanding questions with detailed answers]

                --- COURSE MATERIAL ---
                {context}
                --- END OF COURSE MATERIAL ---

                Generate the practice questions now:
                """));

        specs.put(GenerationMode.ASSIGNMENT, facultySpec(true, """
                You are an expert educator creating an assignment. Using the provided content, generate {num_questions} assignment questions.

                Difficulty Level: {difficulty}

                Guidelines:
                - Create a mix of question types: theory, numerical, analytical, application-based
                - Assign appropriate marks: 2-mark, 5-mark, 10-mark questions
                - Include a marking scheme for each question
                - Ensure questions test different aspects and depth levels

                Content:
                {context}

                Respond with ONLY a JSON array of {num_questions} questions in this format:
                [
                  {
                    "question_number": 1,
                    "question": "Question text here",
                    "type": "theory/numerical/analytical/application",
                    "marks": 5,
                    "marking_scheme": "Point 1 (2 marks), Point 2 (2 marks), Point 3 (1 mark)",
                    "sample_answer": "Brief outline of expected answer"
                  }
                ]
                """));

        specs.put(GenerationMode.MCQ, facultySpec(true, """
                Create {num_questions} multiple choice questions from the given content.

                Difficulty: {difficulty}

                Requirements:
                - 4 options (A, B, C, D) for each question
                - Only ONE correct answer
                - Distractors should be plausible but clearly incorrect
                - Cover different topics from the content
                - Mix factual recall, conceptual, and application-based questions

                Content:
                {context}

                Respond with ONLY a JSON array in this format:
                [
                  {
                    "question_number": 1,
                    "question": "What is...?",
                    "options": {
                      "A": "Option A text",
                      "B": "Option B text",
                      "C": "Option C text",
                      "D": "Option D text"
                    },
                    "correct_answer": "B",
                    "explanation": "Brief explanation of why B is correct"
                  }
                ]
                """));

        specs.put(GenerationMode.VIVA, facultySpec(false, """
                Generate {num_questions} viva (oral examination) questions from the content.

                Viva questions should:
                - Test conceptual understanding
                - Be brief and direct
                - Allow for elaborate verbal answers
                - Cover fundamental and advanced concepts
                - Include some "why" and "how" questions

                Content:
                {context}

                Respond with ONLY a JSON array in this format:
                [
                  {
                    "question_number": 1,
                    "question": "Explain the significance of...",
                    "type": "conceptual/definition/comparison/application",
                    "key_points": ["Point 1 expected in answer", "Point 2", "Point 3"],
                    "difficulty": "easy/medium/hard"
                  }
                ]
                """));

        return specs;
    }

    private static PromptSpec studentSpec(int topK, String template) {
        return PromptSpec.builder()
                .template(template)
                .requiredSlot(CONTEXT)
                .requiredSlot(QUESTION)
                .temperature(STUDENT_TEMPERATURE)
                .maxTokens(STUDENT_MAX_TOKENS)
                .topK(topK)
                .build();
    }

    private static PromptSpec facultySpec(boolean withDifficulty, String template) {
        PromptSpec.PromptSpecBuilder builder = PromptSpec.builder()
                .template(template)
                .requiredSlot(CONTEXT)
                .requiredSlot(NUM_QUESTIONS)
                .temperature(FACULTY_TEMPERATURE)
                .maxTokens(FACULTY_MAX_TOKENS)
                .topK(0);
        if (withDifficulty) {
            builder.requiredSlot(DIFFICULTY);
        }
        return builder.build();
    }
}
