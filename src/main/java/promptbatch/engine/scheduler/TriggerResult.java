package promptbatch.engine.scheduler;

import java.util.List;

/**
 * Summary of one daily trigger invocation.
 *
 * @param status    COMPLETED or SKIPPED
 * @param reason    why the trigger was skipped, null otherwise
 * @param jobs      jobs created or re-armed by this invocation
 * @param skipped   organizations left out (no access, or the window's job is already terminal)
 */
public record TriggerResult(
        String runId,
        String runKey,
        String status,
        String reason,
        boolean forced,
        int created,
        int rearmed,
        int skipped,
        List<DispatchedJob> jobs) {

    /**
     * One job the trigger is responsible for.
     *
     * @param created false when an existing non-terminal job was re-armed
     */
    public record DispatchedJob(String jobId, String orgId, String orgName, int totalTasks, boolean created) {
    }
}
