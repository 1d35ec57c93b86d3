package promptbatch.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * Google Gemini generateContent API.
 */
public class GeminiAdapter extends HttpProviderAdapter {

    public static final String DEFAULT_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash-lite:generateContent";

    public GeminiAdapter(String baseUrl, String apiKey, HttpClient http) {
        super("gemini", "gemini-2.0-flash-lite", URI.create(baseUrl), apiKey, http);
    }

    @Override
    protected ObjectNode requestBody(String promptText) {
        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("contents").addObject()
                .putArray("parts").addObject()
                .put("text", promptText);
        ObjectNode generation = body.putObject("generationConfig");
        generation.put("temperature", 0.3);
        generation.put("topK", 40);
        generation.put("topP", 0.95);
        generation.put("maxOutputTokens", 2000);
        return body;
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder request) {
        return request.header("X-goog-api-key", apiKey());
    }

    @Override
    protected ProviderResponse parse(JsonNode body) {
        JsonNode parts = body.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        JsonNode usage = body.path("usageMetadata");
        return new ProviderResponse(text.toString(), body.path("modelVersion").asText(model()),
                intOrNull(usage.get("promptTokenCount")), intOrNull(usage.get("candidatesTokenCount")));
    }
}
