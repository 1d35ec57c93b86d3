package promptbatch.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.repository.SchedulerRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes the scheduler_runs audit trail. Audit failures are logged and never fail
 * the run being audited.
 */
public class RunRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final SchedulerRunRepository repository;
    private final Clock clock;

    public RunRecorder(SchedulerRunRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Open a RUNNING record.
     *
     * @return the run id
     */
    public String start(String runKey, String function, String triggerSource) {
        String id = "run-" + UUID.randomUUID();
        try {
            repository.start(new SchedulerRun(id, runKey, function, triggerSource, SchedulerRun.RUNNING,
                    clock.instant(), null, null, null));
        } catch (RuntimeException e) {
            log.warn("Could not record start of {} run: {}", function, e.getMessage());
        }
        return id;
    }

    public void finish(String runId, String status, Object result) {
        close(runId, status, result, null);
    }

    public void fail(String runId, Exception error) {
        close(runId, SchedulerRun.FAILED, null, String.valueOf(error.getMessage()));
    }

    private void close(String runId, String status, Object result, String error) {
        try {
            String json = result != null ? MAPPER.writeValueAsString(result) : null;
            repository.finish(runId, status, json, error, clock.instant());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not record end of run {}: {}", runId, e.getMessage());
        }
    }
}
