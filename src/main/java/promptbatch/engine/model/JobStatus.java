package promptbatch.engine.model;

/**
 * Batch job status.
 */
public enum JobStatus {
    /** Job created, no driver has claimed it yet */
    PENDING,
    /** A driver has claimed the job at least once */
    PROCESSING,
    /** Every task reached a terminal state (failed tasks are reported via counters) */
    COMPLETED,
    /** Catastrophic failure - nothing in this job could succeed */
    FAILED,
    /** Job cancelled by an operator */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
