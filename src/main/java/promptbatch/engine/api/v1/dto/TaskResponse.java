package promptbatch.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import promptbatch.engine.model.BatchTask;

import java.time.Instant;

/**
 * One task row of a job. The raw response stays in the store.
 * GET /api/v1/jobs/{jobId}/tasks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("promptId") String promptId,
        @JsonProperty("provider") String provider,
        @JsonProperty("status") String status,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("errorKind") String errorKind,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("model") String model,
        @JsonProperty("runtimeMs") Long runtimeMs,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskResponse from(BatchTask task) {
        return new TaskResponse(
                task.id(),
                task.promptId(),
                task.provider(),
                task.status().name(),
                task.attempts(),
                task.maxAttempts(),
                task.errorKind(),
                task.lastError(),
                task.model(),
                task.runtimeMs(),
                task.finishedAt());
    }
}
