package promptbatch.engine.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base class for adapters that POST a JSON body and read a JSON answer.
 * Maps transport and status failures onto {@link ProviderErrorKind}.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final String model;
    private final URI endpoint;
    private final String apiKey;
    private final HttpClient http;

    protected HttpProviderAdapter(String name, String model, URI endpoint, String apiKey, HttpClient http) {
        this.name = name;
        this.model = model;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.http = http;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    protected String apiKey() {
        return apiKey;
    }

    /** JSON request body for one prompt */
    protected abstract ObjectNode requestBody(String promptText);

    /** Add credentials and provider-specific headers */
    protected abstract HttpRequest.Builder authorize(HttpRequest.Builder request);

    /**
     * Extract text and usage from a 2xx body.
     *
     * @return the response, with null or blank text if the body carries none
     */
    protected abstract ProviderResponse parse(JsonNode body);

    @Override
    public ProviderResponse complete(String promptText, Duration timeout) throws ProviderException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(name, ProviderErrorKind.NOT_CONFIGURED, name + " API key not configured");
        }

        HttpRequest request;
        try {
            request = authorize(HttpRequest.newBuilder(endpoint))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            MAPPER.writeValueAsString(requestBody(promptText)), StandardCharsets.UTF_8))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + name + " request", e);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new ProviderException(name, ProviderErrorKind.TIMEOUT,
                    name + " did not answer within " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new ProviderException(name, ProviderErrorKind.NETWORK, name + " call failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name, ProviderErrorKind.TIMEOUT, name + " call interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug("{} returned HTTP {}: {}", name, status, response.body());
            throw new ProviderException(name, kindForStatus(status),
                    name + " API error: HTTP " + status + " - " + abbreviate(response.body()));
        }

        ProviderResponse parsed;
        try {
            parsed = parse(MAPPER.readTree(response.body()));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new ProviderException(name, ProviderErrorKind.MALFORMED_RESPONSE,
                    name + " returned an unparseable body", e);
        }
        if (parsed == null || parsed.text() == null || parsed.text().isBlank()) {
            throw new ProviderException(name, ProviderErrorKind.MALFORMED_RESPONSE, name + " returned no content");
        }
        return parsed;
    }

    static ProviderErrorKind kindForStatus(int status) {
        if (status == 401 || status == 403) {
            return ProviderErrorKind.AUTH;
        }
        if (status == 429) {
            return ProviderErrorKind.RATE_LIMITED;
        }
        return ProviderErrorKind.HTTP_ERROR;
    }

    protected static Integer intOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.intValue() : null;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
