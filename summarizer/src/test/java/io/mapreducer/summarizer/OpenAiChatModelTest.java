package io.mapreducer.summarizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.mapreducer.core.InvocationOptions;
import io.mapreducer.core.ModelResponse;
import io.mapreducer.core.ProviderException;
import io.mapreducer.core.Usage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAiChatModelTest {
    HttpServer server;
    final ObjectMapper mapper = new ObjectMapper();
    final AtomicReference<HttpExchange> lastExchange = new AtomicReference<>();
    final AtomicReference<String> lastBody = new AtomicReference<>();
    volatile int status = 200;
    volatile String response = "{}";
    volatile Map<String, String> headers = Map.of();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> {
            lastExchange.set(exchange);
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private URI base(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    @Test
    void posts_chat_completion_and_maps_usage() throws Exception {
        response = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Kurzfassung\"}}],"
                + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3,\"total_tokens\":15}}";
        var model = new OpenAiChatModel(base("/v1/"), "gpt-4o-mini", "sk-test", false, Duration.ofSeconds(5));

        ModelResponse res = model.invoke("Fasse zusammen: abc", new InvocationOptions(256, 0.2));

        assertEquals("Kurzfassung", res.content());
        assertEquals(new Usage(12, 3, 15), res.usage());
        assertEquals("/v1/chat/completions", lastExchange.get().getRequestURI().getPath());
        assertEquals("Bearer sk-test", lastExchange.get().getRequestHeaders().getFirst("Authorization"));
        JsonNode sent = mapper.readTree(lastBody.get());
        assertEquals("gpt-4o-mini", sent.path("model").asText());
        assertEquals("user", sent.path("messages").path(0).path("role").asText());
        assertEquals("Fasse zusammen: abc", sent.path("messages").path(0).path("content").asText());
        assertEquals(256, sent.path("max_tokens").asInt());
        assertEquals(0.2, sent.path("temperature").asDouble(), 1e-9);
    }

    @Test
    void azure_uses_api_key_header_and_version() throws Exception {
        response = "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}";
        var model = new OpenAiChatModel(base("/openai/deployments/summarizer"), null, "azure-key", true, Duration.ofSeconds(5));

        ModelResponse res = model.invoke("x", new InvocationOptions(10, 0));

        assertEquals("ok", res.content());
        assertEquals(Usage.NONE, res.usage());
        HttpExchange ex = lastExchange.get();
        assertEquals("/openai/deployments/summarizer/chat/completions", ex.getRequestURI().getPath());
        assertEquals("api-version=" + OpenAiChatModel.DEFAULT_AZURE_API_VERSION, ex.getRequestURI().getQuery());
        assertEquals("azure-key", ex.getRequestHeaders().getFirst("api-key"));
        assertNull(ex.getRequestHeaders().getFirst("Authorization"));
        assertFalse(mapper.readTree(lastBody.get()).has("model"));
    }

    @Test
    void rate_limit_carries_retry_after() {
        status = 429;
        response = "{\"error\":{\"message\":\"Rate limit reached\"}}";
        headers = Map.of("Retry-After", "7");
        var model = new OpenAiChatModel(base("/v1"), "m", "k", false, Duration.ofSeconds(5));

        ProviderException e = assertThrows(ProviderException.class, () -> model.invoke("x", new InvocationOptions(10, 0)));
        assertTrue(e.isRateLimited());
        assertEquals(Duration.ofSeconds(7), e.retryAfter().orElseThrow());
        assertTrue(e.getMessage().contains("Rate limit reached"), e.getMessage());
    }

    @Test
    void server_error_has_no_hint() {
        status = 503;
        response = "upstream unavailable";
        var model = new OpenAiChatModel(base("/v1"), "m", "k", false, Duration.ofSeconds(5));

        ProviderException e = assertThrows(ProviderException.class, () -> model.invoke("x", new InvocationOptions(10, 0)));
        assertTrue(e.isServerError());
        assertTrue(e.retryAfter().isEmpty());
        assertTrue(e.getMessage().contains("upstream unavailable"), e.getMessage());
    }

    @Test
    void missing_content_yields_empty_response() throws Exception {
        response = "{\"choices\":[]}";
        var model = new OpenAiChatModel(base("/v1"), "m", null, false, Duration.ofSeconds(5));
        ModelResponse res = model.invoke("x", new InvocationOptions(10, 0));
        assertTrue(res.isEmpty());
        assertNull(lastExchange.get().getRequestHeaders().getFirst("Authorization"), "no key, no header");
    }

    @Test
    void millisecond_hint_takes_precedence() throws Exception {
        status = 429;
        headers = Map.of("retry-after-ms", "1500", "Retry-After", "9");
        var model = new OpenAiChatModel(base("/v1"), "m", "k", false, Duration.ofSeconds(5));
        ProviderException e = assertThrows(ProviderException.class, () -> model.invoke("x", new InvocationOptions(10, 0)));
        assertEquals(Duration.ofMillis(1500), e.retryAfter().orElseThrow());
    }
}
