package promptbatch.engine.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Thin client for the engine's HTTP API, used by the operational commands.
 */
final class BatchApiClient {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final String SECRET_HEADER = "X-Cron-Secret";

    private final HttpClient http;
    private final String baseUrl;
    private final String secret;

    BatchApiClient(String baseUrl, String secret) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.secret = secret;
    }

    /**
     * POST /internal/v1/trigger
     */
    JsonNode trigger(boolean force, String triggerSource) throws IOException, InterruptedException {
        ObjectNode body = MAPPER.createObjectNode()
                .put("force", force)
                .put("triggerSource", triggerSource);
        HttpRequest.Builder req = HttpRequest.newBuilder(URI.create(baseUrl + "/internal/v1/trigger"))
                .timeout(Duration.ofMinutes(2))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)));
        if (secret != null && !secret.isBlank()) {
            req.header(SECRET_HEADER, secret);
        }
        return send(req.build());
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    JsonNode job(String jobId) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + "/api/v1/jobs/" + jobId))
                .timeout(Duration.ofSeconds(20))
                .GET()
                .build();
        return send(req);
    }

    private JsonNode send(HttpRequest req) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() / 100 != 2) {
            throw new IOException(req.method() + " " + req.uri().getPath() + " failed: status="
                    + resp.statusCode() + " body=" + resp.body());
        }
        return MAPPER.readTree(resp.body());
    }
}
