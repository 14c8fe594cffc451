package com.ai.courseassistant.generation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the prompt table: the template text, the slots it must contain,
 * and the model parameters used with it.
 */
@Value
@Builder
public class PromptSpec {

    private static final Pattern SLOT_MARKER = Pattern.compile("\\{([a-z_]+)}");

    String template;

    @Singular
    Set<String> requiredSlots;

    double temperature;

    int maxTokens;

    /** Chunks retrieved by similarity for student modes; 0 for faculty modes. */
    int topK;

    /**
     * Substitutes {@code {slot}} markers. Other braces, such as the JSON
     * examples inside faculty templates, are left alone.
     *
     * @throws IllegalArgumentException if a required slot has no value
     */
    public String render(Map<String, ?> values) {
        for (String slot : requiredSlots) {
            if (values.get(slot) == null) {
                throw new IllegalArgumentException("Missing value for prompt slot '" + slot + "'");
            }
        }

        // single pass, so slot markers inside substituted values stay literal
        Matcher matcher = SLOT_MARKER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String slot = matcher.group(1);
            String replacement = requiredSlots.contains(slot) ? values.get(slot).toString() : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /** Slot names referenced by {@code {slot}} markers in the template. */
    public Set<String> referencedSlots() {
        Set<String> slots = new LinkedHashSet<>();
        Matcher matcher = SLOT_MARKER.matcher(template);
        while (matcher.find()) {
            slots.add(matcher.group(1));
        }
        return slots;
    }
}
