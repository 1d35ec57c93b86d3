package promptbatch.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * Anthropic messages API, registered as provider "claude".
 */
public class AnthropicAdapter extends HttpProviderAdapter {

    public static final String DEFAULT_URL = "https://api.anthropic.com/v1/messages";
    static final String API_VERSION = "2023-06-01";

    public AnthropicAdapter(String baseUrl, String apiKey, HttpClient http) {
        super("claude", "claude-3-5-haiku-latest", URI.create(baseUrl), apiKey, http);
    }

    @Override
    protected ObjectNode requestBody(String promptText) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model());
        body.put("max_tokens", 2000);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", promptText);
        return body;
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder request) {
        return request
                .header("x-api-key", apiKey())
                .header("anthropic-version", API_VERSION);
    }

    @Override
    protected ProviderResponse parse(JsonNode body) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode usage = body.path("usage");
        return new ProviderResponse(text.toString(), body.path("model").asText(model()),
                intOrNull(usage.get("input_tokens")), intOrNull(usage.get("output_tokens")));
    }
}
