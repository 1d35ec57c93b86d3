package promptbatch.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import promptbatch.engine.model.SchedulerRun;

import java.time.Instant;

/**
 * GET /api/v1/scheduler/runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchedulerRunResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("runKey") String runKey,
        @JsonProperty("function") String function,
        @JsonProperty("triggerSource") String triggerSource,
        @JsonProperty("status") String status,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonRawValue @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    public static SchedulerRunResponse from(SchedulerRun run) {
        return new SchedulerRunResponse(run.id(), run.runKey(), run.functionName(), run.triggerSource(),
                run.status(), run.startedAt(), run.completedAt(), run.result(), run.errorMessage());
    }
}
