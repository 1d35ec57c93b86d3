package promptbatch.engine.provider;

/**
 * Category of a provider call failure.
 */
public enum ProviderErrorKind {
    /** No answer within the call timeout */
    TIMEOUT(true, false),
    /** HTTP 429 */
    RATE_LIMITED(true, false),
    /** Any other non-2xx status */
    HTTP_ERROR(true, false),
    /** 2xx with an empty or unparseable body */
    MALFORMED_RESPONSE(true, false),
    /** HTTP 401/403, credentials rejected */
    AUTH(false, true),
    /** No adapter or no API key for this provider */
    NOT_CONFIGURED(false, true),
    /** Connection refused, reset, DNS */
    NETWORK(true, false);

    private final boolean retriable;
    private final boolean providerFatal;

    ProviderErrorKind(boolean retriable, boolean providerFatal) {
        this.retriable = retriable;
        this.providerFatal = providerFatal;
    }

    public boolean retriable() {
        return retriable;
    }

    /** No call to this provider can succeed until its configuration changes */
    public boolean providerFatal() {
        return providerFatal;
    }
}
