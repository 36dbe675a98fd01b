package io.mapreducer.core;

import java.util.Optional;

public record ModelResponse(String content, Usage usage) {
    public static ModelResponse of(String content) { return new ModelResponse(content, Usage.NONE); }

    public Optional<Usage> usageIfReported() { return Optional.ofNullable(usage); }

    public boolean isEmpty() { return content == null || content.isBlank(); }
}
