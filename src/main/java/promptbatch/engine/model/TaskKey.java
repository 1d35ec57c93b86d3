package promptbatch.engine.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Idempotency key of a task: one prompt on one provider within one job.
 * The task id is derived from the triple, so rebuilding a matrix yields the same ids.
 */
public record TaskKey(String jobId, String promptId, String provider) {

    public TaskKey {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(promptId, "promptId is required");
        Objects.requireNonNull(provider, "provider is required");
    }

    public String taskId() {
        String raw = jobId + '|' + promptId + '|' + provider;
        return UUID.nameUUIDFromBytes(raw.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public String toString() {
        return "(" + jobId + ", " + promptId + ", " + provider + ")";
    }
}
