package promptbatch.engine.provider;

import java.time.Duration;

/**
 * One external AI provider. The engine treats every adapter as a black box that
 * either returns a response or throws.
 */
public interface ProviderAdapter {

    /** Provider identifier as stored on tasks ("openai", "gemini", ...) */
    String name();

    String model();

    /**
     * Run one prompt.
     *
     * @param promptText the prompt
     * @param timeout    bound for the whole call
     * @return the raw response
     * @throws ProviderException on timeout, non-2xx, malformed body or missing credentials
     */
    ProviderResponse complete(String promptText, Duration timeout) throws ProviderException;
}
