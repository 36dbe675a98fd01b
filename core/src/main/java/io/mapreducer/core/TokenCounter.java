package io.mapreducer.core;

/**
 * Pure token counting function. Must be deterministic; adding text should never lower the count,
 * otherwise budget estimates lose their meaning.
 */
@FunctionalInterface
public interface TokenCounter {
    int count(String text, TokenEncoding encoding);
}
