package promptbatch.engine.model;

/**
 * Result of failing a task.
 */
public enum TaskFailResult {
    /** Task returned to PENDING and will be dispatched again */
    RETRIED,

    /** Task failed permanently (attempts exhausted or non-retriable error) */
    FAILED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_TERMINAL,

    /** Parent job is terminal; nothing was written */
    JOB_TERMINAL,

    /** Task not found */
    NOT_FOUND
}
