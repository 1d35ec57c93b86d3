package promptbatch.engine.scheduler;

import java.util.List;

/**
 * Summary of one reconciler sweep.
 *
 * @param scanned   stale jobs examined
 * @param finalized jobs closed without dispatching work
 * @param resumed   jobs handed to a fresh driver
 * @param skipped   jobs left alone (driver still running in this process, or errors)
 */
public record ReconcileReport(String runId, int scanned, List<String> finalized, List<String> resumed,
        List<String> skipped) {

    public boolean isIdle() {
        return scanned == 0;
    }
}
