package io.mapreducer.summarizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the text to summarize from input files. JSON documents are re-serialized compactly,
 * anything else is taken verbatim; inputs are separated by a blank line.
 */
public class InputAssembler {
    private final ObjectMapper mapper;

    public InputAssembler(ObjectMapper mapper) { this.mapper = mapper; }

    public String assemble(List<Path> inputs) throws IOException {
        List<String> parts = new ArrayList<>(inputs.size());
        for (Path p : inputs) {
            String text = Files.readString(p, StandardCharsets.UTF_8);
            if (!text.isBlank()) parts.add(normalize(text));
        }
        return String.join("\n\n", parts);
    }

    String normalize(String text) {
        String trimmed = text.trim();
        if (!(trimmed.startsWith("[") || trimmed.startsWith("{"))) return text;
        try {
            JsonNode node = mapper.readTree(trimmed);
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return text;
        }
    }
}
