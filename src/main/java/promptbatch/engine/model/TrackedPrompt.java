package promptbatch.engine.model;

import java.time.Instant;

/**
 * A prompt an organization tracks daily.
 */
public record TrackedPrompt(String id, String orgId, String text, boolean active, Instant createdAt) {
}
