package io.mapreducer.summarizer;

import io.mapreducer.core.PromptTemplate;
import io.mapreducer.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Loads prompt templates from a user file or from the bundled defaults. */
public final class Prompts {
    public static final String MAP_RESOURCE = "prompts/map.txt";
    public static final String COMBINE_RESOURCE = "prompts/combine.txt";

    private Prompts() {}

    public static PromptTemplate map(Path override) throws ConfigurationException {
        return load("mapPrompt", override, MAP_RESOURCE);
    }

    public static PromptTemplate combine(Path override) throws ConfigurationException {
        return load("combinePrompt", override, COMBINE_RESOURCE);
    }

    static PromptTemplate load(String key, Path override, String resource) throws ConfigurationException {
        String text;
        if (override != null) {
            try {
                text = Files.readString(override, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigurationException(key, "Cannot read " + key + " file " + override + ": " + e.getMessage(), e);
            }
        } else {
            try (InputStream in = Prompts.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) throw new ConfigurationException(key, "Missing classpath resource " + resource);
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigurationException(key, "Cannot read " + resource + ": " + e.getMessage(), e);
            }
        }
        if (text.isBlank()) throw new ConfigurationException(key, key + " is required but empty");
        return PromptTemplate.of(text);
    }
}
