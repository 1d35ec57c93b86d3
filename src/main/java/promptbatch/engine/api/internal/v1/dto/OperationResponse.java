package promptbatch.engine.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for single-job operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("result") String result) {

    public static OperationResponse of(boolean ok, String jobId, Enum<?> result) {
        return new OperationResponse(ok, jobId, result.name());
    }
}
