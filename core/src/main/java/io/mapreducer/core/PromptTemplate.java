package io.mapreducer.core;

import java.util.Objects;

/**
 * Prompt text with a single {@value #PLACEHOLDER} slot that receives the segment or the joined
 * group being summarized.
 */
public final class PromptTemplate {
    public static final String PLACEHOLDER = "{text}";

    private final String template;

    private PromptTemplate(String template) { this.template = template; }

    public static PromptTemplate of(String template) {
        Objects.requireNonNull(template, "template");
        if (template.isBlank()) throw new IllegalArgumentException("prompt template must not be blank");
        return new PromptTemplate(template);
    }

    public String format(String text) {
        return template.replace(PLACEHOLDER, text == null ? "" : text);
    }

    public boolean hasPlaceholder() { return template.contains(PLACEHOLDER); }

    public String template() { return template; }

    @Override
    public String toString() { return "PromptTemplate{" + template.length() + " chars}"; }
}
