package promptbatch.engine.scheduler;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.SchedulerRunRepository;
import promptbatch.engine.service.DriverLauncher;
import promptbatch.engine.service.RunRecorder;
import promptbatch.engine.service.TaskMatrixBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Daily entry point: one job per eligible organization and run window, each with its
 * matrix built and a driver started.
 *
 * <p>
 * Runs only inside the execution window and once per window unless forced. Forcing
 * never creates a second job for an organization and window; it re-arms drivers for
 * jobs that are still open.
 * </p>
 */
public class DailyTrigger {

    private static final Logger log = LoggerFactory.getLogger(DailyTrigger.class);

    public static final String FUNCTION = "daily-batch-trigger";

    private final JobRepository jobRepository;
    private final PromptCatalog catalog;
    private final SchedulerRunRepository runRepository;
    private final TaskMatrixBuilder matrixBuilder;
    private final DriverLauncher launcher;
    private final RunRecorder recorder;
    private final RunWindow window;
    private final EngineConfig config;

    public DailyTrigger(JobRepository jobRepository, PromptCatalog catalog, SchedulerRunRepository runRepository,
            TaskMatrixBuilder matrixBuilder, DriverLauncher launcher, RunRecorder recorder, EngineConfig config) {
        this.jobRepository = jobRepository;
        this.catalog = catalog;
        this.runRepository = runRepository;
        this.matrixBuilder = matrixBuilder;
        this.launcher = launcher;
        this.recorder = recorder;
        this.window = new RunWindow(config.runZone(), config.windowStartHour(), config.windowEndHour());
        this.config = config;
    }

    public RunWindow window() {
        return window;
    }

    /**
     * Fire the trigger.
     *
     * @param force         bypass the window and "already ran" guards
     * @param triggerSource who fired it ("scheduler", "http", "cli", ...)
     * @return summary, also written to the scheduler_runs audit trail
     */
    public synchronized TriggerResult trigger(boolean force, String triggerSource) {
        Instant now = config.clock().instant();
        String runKey = window.runKey(now);
        String source = triggerSource != null ? triggerSource : "unknown";

        if (!force) {
            String reason = null;
            if (!window.isOpen(now)) {
                reason = "Outside execution window " + window;
            } else if (runKey.equals(runRepository.lastDailyRunKey().orElse(null))) {
                reason = "Already ran for " + runKey;
            }
            if (reason != null) {
                log.debug("Daily trigger skipped: {}", reason);
                String runId = recorder.start(runKey, FUNCTION, source);
                TriggerResult skippedResult = new TriggerResult(runId, runKey, SchedulerRun.SKIPPED, reason, false,
                        0, 0, 0, List.of());
                recorder.finish(runId, SchedulerRun.SKIPPED, skippedResult);
                return skippedResult;
            }
        }

        String runId = recorder.start(runKey, FUNCTION, source);
        log.info("Daily trigger {} for window {} (source={}, force={})", runId, runKey, source, force);

        try {
            List<TriggerResult.DispatchedJob> jobs = new ArrayList<>();
            int created = 0;
            int rearmed = 0;
            int skipped = 0;

            for (Organization org : catalog.findOrganizations()) {
                try {
                    Optional<TriggerResult.DispatchedJob> dispatched = dispatch(org, runKey, source, now);
                    if (dispatched.isEmpty()) {
                        skipped++;
                        continue;
                    }
                    jobs.add(dispatched.get());
                    if (dispatched.get().created()) {
                        created++;
                    } else {
                        rearmed++;
                    }
                } catch (RuntimeException e) {
                    // one organization must not stop the others
                    log.error("Daily trigger failed for org {}", org.id(), e);
                    skipped++;
                }
            }

            runRepository.markDailyRun(runKey, config.clock().instant());
            TriggerResult result = new TriggerResult(runId, runKey, SchedulerRun.COMPLETED, null, force,
                    created, rearmed, skipped, List.copyOf(jobs));
            recorder.finish(runId, SchedulerRun.COMPLETED, result);
            log.info("Daily trigger {} done: {} jobs created, {} re-armed, {} orgs skipped",
                    runId, created, rearmed, skipped);
            return result;
        } catch (RuntimeException e) {
            recorder.fail(runId, e);
            throw e;
        }
    }

    private Optional<TriggerResult.DispatchedJob> dispatch(Organization org, String runKey, String source,
            Instant now) {
        if (!org.hasAccess(now)) {
            log.debug("Org {} skipped: no active subscription", org.id());
            return Optional.empty();
        }

        // An open job (this window or an older one) blocks creation; make sure it is driven
        Optional<BatchJob> open = jobRepository.findActiveByOrg(org.id());
        if (open.isPresent()) {
            return Optional.of(rearm(org, open.get()));
        }

        if (jobRepository.findByOrgAndRunKey(org.id(), runKey).isPresent()) {
            log.debug("Org {} already has a finished job for {}", org.id(), runKey);
            return Optional.empty();
        }

        BatchJob job = BatchJob.builder()
                .id(jobRepository.generateId())
                .orgId(org.id())
                .runKey(runKey)
                .status(JobStatus.PENDING)
                .createdAt(now)
                .triggerSource(source)
                .build();

        if (!jobRepository.insert(job)) {
            // lost a race with a concurrent trigger
            return jobRepository.findActiveByOrg(org.id()).map(existing -> rearm(org, existing));
        }
        log.info("Created job {} for org {} ({}, window {})", job.id(), org.id(), org.tier(), runKey);

        TaskMatrixBuilder.MatrixResult matrix = matrixBuilder.build(job, org);
        if (matrix.totalTasks() > 0) {
            launcher.launch(job.id());
        }
        return Optional.of(new TriggerResult.DispatchedJob(job.id(), org.id(), org.displayName(),
                matrix.totalTasks(), true));
    }

    private TriggerResult.DispatchedJob rearm(Organization org, BatchJob job) {
        int total = job.totalTasks();
        if (!job.isMatrixBuilt()) {
            total = matrixBuilder.build(job, org).totalTasks();
        }
        launcher.launch(job.id());
        log.info("Org {} already has open job {} ({}), driver re-armed", org.id(), job.id(), job.status());
        return new TriggerResult.DispatchedJob(job.id(), org.id(), org.displayName(), total, false);
    }
}
