package promptbatch.engine.provider;

/**
 * A provider call that did not produce a usable response.
 */
public class ProviderException extends Exception {

    private final String provider;
    private final ProviderErrorKind kind;

    public ProviderException(String provider, ProviderErrorKind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String provider() {
        return provider;
    }

    public ProviderErrorKind kind() {
        return kind;
    }

    public boolean retriable() {
        return kind.retriable();
    }
}
