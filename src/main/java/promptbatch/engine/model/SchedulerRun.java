package promptbatch.engine.model;

import java.time.Instant;

/**
 * Audit record of one trigger or reconciler invocation.
 *
 * @param status RUNNING, COMPLETED, SKIPPED or FAILED
 * @param result JSON summary written when the run ends
 */
public record SchedulerRun(
        String id,
        String runKey,
        String functionName,
        String triggerSource,
        String status,
        Instant startedAt,
        Instant completedAt,
        String result,
        String errorMessage) {

    public static final String RUNNING = "RUNNING";
    public static final String COMPLETED = "COMPLETED";
    public static final String SKIPPED = "SKIPPED";
    public static final String FAILED = "FAILED";
}
