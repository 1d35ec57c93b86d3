package promptbatch.engine.model;

/**
 * Result of completing a task.
 */
public enum TaskCompleteResult {
    /** Task moved to COMPLETED and the job counter was incremented */
    COMPLETED,

    /**
     * Task was already in a terminal state - idempotent success, counters untouched
     */
    ALREADY_TERMINAL,

    /** Parent job is terminal; nothing was written */
    JOB_TERMINAL,

    /** Task not found */
    NOT_FOUND
}
