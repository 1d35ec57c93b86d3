package promptbatch.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Organization as seen by the batch engine: identity, plan and provider choice.
 */
public record Organization(
        String id,
        String name,
        SubscriptionTier tier,
        boolean subscribed,
        Instant trialExpiresAt,
        List<String> pinnedProviders) {

    public Organization {
        Objects.requireNonNull(id, "id is required");
        tier = tier != null ? tier : SubscriptionTier.FREE;
        pinnedProviders = pinnedProviders != null ? List.copyOf(pinnedProviders) : List.of();
    }

    /** Active subscription, or a trial that has not expired yet */
    public boolean hasAccess(Instant now) {
        if (subscribed) {
            return true;
        }
        return trialExpiresAt != null && now.isBefore(trialExpiresAt);
    }

    public List<String> effectiveProviders() {
        return tier.providersFor(pinnedProviders);
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
