package io.mapreducer.core;

import java.util.Locale;

/** Tokenizer encodings accepted for budget estimates. */
public enum TokenEncoding {
    O200K("o200k"),
    CL100K("cl100k");

    private final String id;

    TokenEncoding(String id) { this.id = id; }

    public String id() { return id; }

    public static TokenEncoding fromId(String id) {
        if (id == null) throw new IllegalArgumentException("encoding id must not be null");
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("_base")) normalized = normalized.substring(0, normalized.length() - "_base".length());
        for (TokenEncoding e : values()) {
            if (e.id.equals(normalized)) return e;
        }
        throw new IllegalArgumentException("Unknown encoding '" + id + "', expected o200k or cl100k");
    }

    @Override
    public String toString() { return id; }
}
