package promptbatch.engine.provider;

/**
 * Raw answer of one provider call.
 *
 * @param tokensIn  prompt tokens reported by the provider, null if not reported
 * @param tokensOut completion tokens reported by the provider, null if not reported
 */
public record ProviderResponse(String text, String model, Integer tokensIn, Integer tokensOut) {
}
