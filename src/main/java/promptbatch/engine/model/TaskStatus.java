package promptbatch.engine.model;

/**
 * Task execution status.
 */
public enum TaskStatus {
    /** Waiting to be dispatched (or returned after a retriable failure) */
    PENDING,
    /** Provider call succeeded and the raw response is stored */
    COMPLETED,
    /** Failed permanently for this job */
    FAILED,
    /** Job was cancelled before the task ran */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
