package promptbatch.engine.provider;

import promptbatch.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Provider name to adapter lookup.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();

    public ProviderRegistry register(ProviderAdapter adapter) {
        adapters.put(adapter.name(), adapter);
        return this;
    }

    public Optional<ProviderAdapter> find(String provider) {
        return Optional.ofNullable(adapters.get(provider));
    }

    public Collection<ProviderAdapter> all() {
        return Collections.unmodifiableCollection(adapters.values());
    }

    /**
     * HTTP adapters for the whole provider catalogue. Providers without a key are still
     * registered; their calls fail with NOT_CONFIGURED.
     */
    public static ProviderRegistry fromConfig(EngineConfig config) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();

        ProviderRegistry registry = new ProviderRegistry()
                .register(OpenAiCompatibleAdapter.openAi(
                        config.providerBaseUrl("openai", OpenAiCompatibleAdapter.OPENAI_URL),
                        config.providerKey("openai"), http))
                .register(OpenAiCompatibleAdapter.perplexity(
                        config.providerBaseUrl("perplexity", OpenAiCompatibleAdapter.PERPLEXITY_URL),
                        config.providerKey("perplexity"), http))
                .register(new GeminiAdapter(
                        config.providerBaseUrl("gemini", GeminiAdapter.DEFAULT_URL),
                        config.providerKey("gemini"), http))
                .register(new AnthropicAdapter(
                        config.providerBaseUrl("claude", AnthropicAdapter.DEFAULT_URL),
                        config.providerKey("claude"), http));

        for (ProviderAdapter adapter : registry.all()) {
            if (config.providerKey(adapter.name()) == null) {
                log.warn("Provider {} has no API key; its tasks will fail as NOT_CONFIGURED", adapter.name());
            }
        }
        return registry;
    }
}
