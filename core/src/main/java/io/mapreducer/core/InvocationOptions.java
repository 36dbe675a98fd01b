package io.mapreducer.core;

public record InvocationOptions(int maxOutputTokens, double temperature) {
    public InvocationOptions {
        if (maxOutputTokens <= 0) throw new IllegalArgumentException("maxOutputTokens must be > 0");
        if (temperature < 0 || temperature > 2) throw new IllegalArgumentException("temperature must be within [0, 2]");
    }
}
