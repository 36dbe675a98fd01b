package io.mapreducer.summarizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mapreducer.core.InvocationOptions;
import io.mapreducer.core.LanguageModel;
import io.mapreducer.core.ModelResponse;
import io.mapreducer.core.ProviderException;
import io.mapreducer.core.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Chat-completions client for OpenAI-compatible endpoints and Azure OpenAI deployments.
 *
 * <p>OpenAI: {@code POST {endpoint}/chat/completions} with a bearer token and the model name in
 * the body. Azure: {@code endpoint} is the deployment URL, the key goes into the {@code api-key}
 * header and the API version into the query string.
 */
public class OpenAiChatModel implements LanguageModel {
    private static final Logger log = LoggerFactory.getLogger(OpenAiChatModel.class);
    public static final String DEFAULT_AZURE_API_VERSION = "2024-06-01";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI uri;
    private final String model;
    private final String apiKey;
    private final boolean azure;
    private final Duration timeout;

    public OpenAiChatModel(URI endpoint, String model, String apiKey, boolean azure, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), new ObjectMapper(),
                endpoint, model, apiKey, azure, DEFAULT_AZURE_API_VERSION, timeout);
    }

    public OpenAiChatModel(HttpClient client, ObjectMapper mapper, URI endpoint, String model, String apiKey,
                           boolean azure, String azureApiVersion, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(endpoint, "endpoint");
        this.model = model;
        this.apiKey = apiKey;
        this.azure = azure;
        this.timeout = timeout == null ? Duration.ofMinutes(5) : timeout;
        String base = endpoint.toString().replaceAll("/+$", "");
        this.uri = URI.create(base + "/chat/completions" + (azure ? "?api-version=" + azureApiVersion : ""));
        if (!azure && (model == null || model.isBlank())) throw new IllegalArgumentException("model is required");
    }

    @Override
    public ModelResponse invoke(String prompt, InvocationOptions options) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody(prompt, options)));
        if (apiKey != null && !apiKey.isBlank()) {
            if (azure) req.header("api-key", apiKey);
            else req.header("Authorization", "Bearer " + apiKey);
        }

        HttpResponse<byte[]> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofByteArray());
        int status = resp.statusCode();
        if (status / 100 != 2) {
            String body = new String(resp.body(), StandardCharsets.UTF_8);
            Duration retryAfter = retryAfter(resp.headers()).orElse(null);
            log.debug("Chat completion failed with HTTP {} (retry-after={})", status, retryAfter);
            throw new ProviderException(status, retryAfter, "HTTP " + status + " from chat endpoint: " + errorMessage(body));
        }
        return parse(resp.body());
    }

    byte[] requestBody(String prompt, InvocationOptions options) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        if (!azure) body.put("model", model);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        body.put("max_tokens", options.maxOutputTokens());
        body.put("temperature", options.temperature());
        return mapper.writeValueAsBytes(body);
    }

    ModelResponse parse(byte[] body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        String text = content.isTextual() ? content.asText() : "";
        JsonNode usage = root.path("usage");
        if (usage.isMissingNode() || usage.isNull()) return new ModelResponse(text, Usage.NONE);
        return new ModelResponse(text, new Usage(intOrNull(usage, "prompt_tokens"),
                intOrNull(usage, "completion_tokens"), intOrNull(usage, "total_tokens")));
    }

    private String errorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("error").path("message");
            if (msg.isTextual()) return msg.asText();
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    static Optional<Duration> retryAfter(HttpHeaders headers) {
        Optional<String> ms = headers.firstValue("retry-after-ms");
        if (ms.isPresent()) {
            try {
                return Optional.of(Duration.ofMillis(Math.max(0, (long) Double.parseDouble(ms.get().trim()))));
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparsable retry-after-ms header '{}'", ms.get());
            }
        }
        Optional<String> seconds = headers.firstValue("retry-after");
        if (seconds.isPresent()) {
            try {
                return Optional.of(Duration.ofMillis(Math.max(0, (long) (Double.parseDouble(seconds.get().trim()) * 1000))));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric retry-after header '{}'", seconds.get());
            }
        }
        return Optional.empty();
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isNumber() && v.canConvertToInt() ? v.asInt() : null;
    }

    @Override
    public String toString() {
        return "OpenAiChatModel{uri=" + uri + ", model=" + model + ", azure=" + azure + '}';
    }
}
