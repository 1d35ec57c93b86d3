package promptbatch.engine.service;

import promptbatch.engine.model.BatchTask;
import promptbatch.engine.provider.ProviderErrorKind;

/**
 * What one task execution did to the store.
 *
 * @param errorKind provider error category, null on success or for non-provider errors
 */
public record TaskOutcome(BatchTask task, Status status, ProviderErrorKind errorKind, String error) {

    public enum Status {
        /** Task completed, counter incremented */
        COMPLETED,
        /** Attempt failed, task back in the pending pool */
        RETRY_SCHEDULED,
        /** Task permanently failed, counter incremented */
        FAILED,
        /** Nothing written: task or job already terminal, or the store rejected the write */
        DISCARDED
    }

    public static TaskOutcome completed(BatchTask task) {
        return new TaskOutcome(task, Status.COMPLETED, null, null);
    }

    public static TaskOutcome discarded(BatchTask task, String reason) {
        return new TaskOutcome(task, Status.DISCARDED, null, reason);
    }

    /** The failure says nothing sent to this provider can succeed */
    public boolean providerFatal() {
        return errorKind != null && errorKind.providerFatal();
    }
}
