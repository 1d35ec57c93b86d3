package promptbatch.engine.service;

import promptbatch.engine.model.TaskKey;
import promptbatch.engine.provider.ProviderResponse;

/**
 * Receives raw responses of completed tasks for downstream analysis.
 * Called after the completion is committed; whatever it does has no effect on the task.
 */
@FunctionalInterface
public interface ResponseHandoff {

    void accept(TaskKey key, ProviderResponse response) throws Exception;

    /** Default hand-off when no analysis pipeline is attached */
    static ResponseHandoff none() {
        return (key, response) -> {
        };
    }
}
