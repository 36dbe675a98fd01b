package io.mapreducer.summarizer;

import java.net.URI;
import java.time.Duration;

/** Connection settings for the chat endpoint. The API key is kept out of {@link #toString()}. */
public record ModelSettings(URI endpoint, String model, String apiKey, boolean azure, Duration requestTimeout) {
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    @Override
    public String toString() {
        return "ModelSettings{endpoint=" + endpoint + ", model=" + model + ", azure=" + azure
                + ", apiKey=" + (apiKey == null || apiKey.isBlank() ? "<none>" : "***") + ", requestTimeout=" + requestTimeout + '}';
    }
}
