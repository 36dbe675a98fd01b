package io.mapreducer.summarizer;

import io.mapreducer.core.PromptTemplate;
import io.mapreducer.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PromptsTest {
    @Test
    void bundled_prompts_have_placeholder() throws Exception {
        PromptTemplate map = Prompts.map(null);
        PromptTemplate combine = Prompts.combine(null);
        assertTrue(map.hasPlaceholder());
        assertTrue(combine.hasPlaceholder());
        assertTrue(map.template().contains("Array[1]"));
        assertTrue(combine.template().contains("HTML"));
    }

    @Test
    void override_file_replaces_default(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("map.txt");
        Files.writeString(f, "Summarize: {text}", StandardCharsets.UTF_8);
        assertEquals("Summarize: x", Prompts.map(f).format("x"));
    }

    @Test
    void blank_or_missing_override_is_a_configuration_error(@TempDir Path dir) throws Exception {
        Path blank = dir.resolve("blank.txt");
        Files.writeString(blank, "  ", StandardCharsets.UTF_8);
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> Prompts.combine(blank));
        assertEquals("combinePrompt", e.key());
        assertThrows(ConfigurationException.class, () -> Prompts.map(dir.resolve("missing.txt")));
    }
}
