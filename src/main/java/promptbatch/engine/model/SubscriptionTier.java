package promptbatch.engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plan tier of an organization. Bounds how many prompts go into a daily matrix and
 * how many providers each prompt is run against.
 */
public enum SubscriptionTier {
    FREE(5, 1),
    STARTER(25, 2),
    GROWTH(100, 4),
    PRO(300, 4);

    /** Providers in default order; tiers take a prefix of this list */
    public static final List<String> PROVIDER_CATALOGUE = List.of("openai", "perplexity", "gemini", "claude");

    private final int promptsPerDay;
    private final int providerCount;

    SubscriptionTier(int promptsPerDay, int providerCount) {
        this.promptsPerDay = promptsPerDay;
        this.providerCount = providerCount;
    }

    public int promptsPerDay() {
        return promptsPerDay;
    }

    public int providerCount() {
        return providerCount;
    }

    /**
     * Providers a job for this tier runs against.
     *
     * @param pinned the organization's own provider choice, empty for the default
     * @return pinned (or catalogue) providers, de-duplicated and cut to the tier size
     */
    public List<String> providersFor(List<String> pinned) {
        List<String> source = pinned == null || pinned.isEmpty() ? PROVIDER_CATALOGUE : pinned;
        List<String> result = new ArrayList<>();
        for (String p : source) {
            String name = p.trim().toLowerCase(Locale.ROOT);
            if (!name.isEmpty() && !result.contains(name)) {
                result.add(name);
            }
            if (result.size() == providerCount) {
                break;
            }
        }
        return List.copyOf(result);
    }

    /** Lenient parse; unknown or missing tiers fall back to FREE */
    public static SubscriptionTier fromName(String name) {
        if (name == null || name.isBlank()) {
            return FREE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}
