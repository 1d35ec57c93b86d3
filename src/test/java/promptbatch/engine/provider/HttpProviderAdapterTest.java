package promptbatch.engine.provider;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Adapters against a local stand-in for the provider APIs.
 */
class HttpProviderAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private HttpServer server;
    private int port;
    private boolean stopped;
    private final HttpClient http = HttpClient.newHttpClient();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String answer = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            lastAuth.set(auth != null ? auth : exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = answer.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        port = server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        if (!stopped) {
            server.stop(0);
        }
    }

    private String url(String path) {
        return "http://127.0.0.1:" + port + path;
    }

    private void respond(int status, String body) {
        this.status = status;
        this.answer = body;
    }

    @Test
    void openAiAnswerIsParsed() throws Exception {
        respond(200, """
                {"model":"gpt-4o-mini-2024","choices":[{"message":{"role":"assistant","content":"Acme is mentioned."}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":34}}
                """);
        ProviderAdapter openai = OpenAiCompatibleAdapter.openAi(url("/v1/chat/completions"), "sk-test", http);

        ProviderResponse response = openai.complete("Who makes the best widgets?", TIMEOUT);

        assertEquals("Acme is mentioned.", response.text());
        assertEquals("gpt-4o-mini-2024", response.model());
        assertEquals(12, response.tokensIn());
        assertEquals(34, response.tokensOut());
        assertEquals("Bearer sk-test", lastAuth.get());
        assertTrue(lastBody.get().contains("Who makes the best widgets?"));
    }

    @Test
    void geminiPartsAreJoined() throws Exception {
        respond(200, """
                {"candidates":[{"content":{"parts":[{"text":"Part one. "},{"text":"Part two."}]}}],
                 "usageMetadata":{"promptTokenCount":5}}
                """);
        ProviderAdapter gemini = new GeminiAdapter(url("/gemini"), "g-key", http);

        ProviderResponse response = gemini.complete("hello", TIMEOUT);

        assertEquals("Part one. Part two.", response.text());
        assertEquals("gemini-2.0-flash-lite", response.model());
        assertEquals(5, response.tokensIn());
        assertNull(response.tokensOut());
    }

    @Test
    void anthropicTextBlocksAreJoined() throws Exception {
        respond(200, """
                {"model":"claude-3-5-haiku","content":[{"type":"text","text":"Hi"},{"type":"tool_use","id":"x"}],
                 "usage":{"input_tokens":3,"output_tokens":1}}
                """);
        ProviderAdapter claude = new AnthropicAdapter(url("/v1/messages"), "ant-key", http);

        ProviderResponse response = claude.complete("hello", TIMEOUT);

        assertEquals("claude", claude.name());
        assertEquals("Hi", response.text());
        assertEquals("ant-key", lastAuth.get());
    }

    @Test
    void statusCodesMapToErrorKinds() {
        ProviderAdapter openai = OpenAiCompatibleAdapter.openAi(url("/v1"), "sk-test", http);

        respond(401, "{\"error\":\"bad key\"}");
        assertEquals(ProviderErrorKind.AUTH, kindOf(openai));

        respond(429, "{\"error\":\"slow down\"}");
        ProviderException limited = assertThrows(ProviderException.class, () -> openai.complete("x", TIMEOUT));
        assertEquals(ProviderErrorKind.RATE_LIMITED, limited.kind());
        assertTrue(limited.retriable());

        respond(503, "unavailable");
        assertEquals(ProviderErrorKind.HTTP_ERROR, kindOf(openai));
    }

    @Test
    void unusableBodiesAreMalformed() {
        ProviderAdapter openai = OpenAiCompatibleAdapter.openAi(url("/v1"), "sk-test", http);

        respond(200, "not json");
        assertEquals(ProviderErrorKind.MALFORMED_RESPONSE, kindOf(openai));

        respond(200, "{\"choices\":[]}");
        assertEquals(ProviderErrorKind.MALFORMED_RESPONSE, kindOf(openai));
    }

    @Test
    void missingKeyFailsWithoutCalling() {
        ProviderAdapter perplexity = OpenAiCompatibleAdapter.perplexity(url("/pplx"), null, http);

        ProviderException e = assertThrows(ProviderException.class, () -> perplexity.complete("x", TIMEOUT));

        assertEquals(ProviderErrorKind.NOT_CONFIGURED, e.kind());
        assertTrue(e.kind().providerFatal());
        assertNull(lastBody.get());
    }

    @Test
    void refusedConnectionIsNetworkError() {
        server.stop(0);
        stopped = true;
        ProviderAdapter openai = OpenAiCompatibleAdapter.openAi(url("/v1"), "sk-test", http);

        assertEquals(ProviderErrorKind.NETWORK, kindOf(openai));
    }

    private static ProviderErrorKind kindOf(ProviderAdapter adapter) {
        return assertThrows(ProviderException.class, () -> adapter.complete("x", TIMEOUT)).kind();
    }
}
