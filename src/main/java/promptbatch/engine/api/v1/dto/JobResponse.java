package promptbatch.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import promptbatch.engine.model.BatchJob;

import java.time.Instant;

/**
 * Operator view of one job.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("orgId") String orgId,
        @JsonProperty("runKey") String runKey,
        @JsonProperty("status") String status,
        @JsonProperty("totalTasks") int totalTasks,
        @JsonProperty("completedTasks") int completedTasks,
        @JsonProperty("failedTasks") int failedTasks,
        @JsonProperty("progressPercent") int progressPercent,
        @JsonProperty("completed") String completed,
        @JsonProperty("failed") String failed,
        @JsonProperty("driverActive") boolean driverActive,
        @JsonProperty("driverLastPing") Instant driverLastPing,
        @JsonProperty("runCount") int runCount,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("triggerSource") String triggerSource,
        @JsonProperty("error") String error) {

    /** Create response from domain model */
    public static JobResponse from(BatchJob job) {
        return new JobResponse(
                job.id(),
                job.orgId(),
                job.runKey(),
                job.status().name(),
                job.totalTasks(),
                job.completedTasks(),
                job.failedTasks(),
                job.progressPercent(),
                job.completedTasks() + "/" + job.totalTasks(),
                job.failedTasks() + "/" + job.totalTasks(),
                job.driverActive(),
                job.driverLastPing(),
                job.runCount(),
                job.createdAt(),
                job.startedAt(),
                job.finishedAt(),
                job.triggerSource(),
                job.errorMessage());
    }
}
