package promptbatch.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * Chat-completions API, as served by OpenAI and Perplexity.
 */
public class OpenAiCompatibleAdapter extends HttpProviderAdapter {

    public static final String OPENAI_URL = "https://api.openai.com/v1/chat/completions";
    public static final String PERPLEXITY_URL = "https://api.perplexity.ai/chat/completions";

    private final int maxTokens;

    public OpenAiCompatibleAdapter(String name, String model, URI endpoint, String apiKey, int maxTokens,
            HttpClient http) {
        super(name, model, endpoint, apiKey, http);
        this.maxTokens = maxTokens;
    }

    public static OpenAiCompatibleAdapter openAi(String baseUrl, String apiKey, HttpClient http) {
        return new OpenAiCompatibleAdapter("openai", "gpt-4o-mini", URI.create(baseUrl), apiKey, 4000, http);
    }

    public static OpenAiCompatibleAdapter perplexity(String baseUrl, String apiKey, HttpClient http) {
        return new OpenAiCompatibleAdapter("perplexity", "llama-3.1-sonar-small-128k-online",
                URI.create(baseUrl), apiKey, 4000, http);
    }

    @Override
    protected ObjectNode requestBody(String promptText) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model());
        body.put("max_tokens", maxTokens);
        body.put("temperature", 0.3);
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", promptText);
        return body;
    }

    @Override
    protected HttpRequest.Builder authorize(HttpRequest.Builder request) {
        return request.header("Authorization", "Bearer " + apiKey());
    }

    @Override
    protected ProviderResponse parse(JsonNode body) {
        String text = body.path("choices").path(0).path("message").path("content").asText(null);
        JsonNode usage = body.path("usage");
        String model = body.path("model").asText(model());
        return new ProviderResponse(text, model,
                intOrNull(usage.get("prompt_tokens")), intOrNull(usage.get("completion_tokens")));
    }
}
