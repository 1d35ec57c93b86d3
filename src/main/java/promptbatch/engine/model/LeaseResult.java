package promptbatch.engine.model;

/**
 * Result of a driver trying to claim the soft lease on a job.
 */
public enum LeaseResult {
    /** Caller is now the active driver */
    CLAIMED,
    /** Another driver's heartbeat is still fresh */
    HELD_BY_OTHER,
    /** Job already finished */
    JOB_TERMINAL,
    NOT_FOUND
}
