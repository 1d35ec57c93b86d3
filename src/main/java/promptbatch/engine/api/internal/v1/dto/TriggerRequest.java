package promptbatch.engine.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for the daily trigger.
 * POST /internal/v1/trigger (empty body allowed)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerRequest(
        @JsonProperty("force") boolean force,
        @JsonProperty("triggerSource") String triggerSource) {

    public static TriggerRequest empty() {
        return new TriggerRequest(false, null);
    }

    public String sourceOrDefault() {
        return triggerSource != null && !triggerSource.isBlank() ? triggerSource : "http";
    }
}
