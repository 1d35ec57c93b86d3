package promptbatch.engine.scheduler;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.TaskRepository;
import promptbatch.engine.service.BatchDriver;
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
 * Background sweep that recovers jobs whose driver has gone quiet.
 *
 * Jobs can get stuck if:
 * - The process hosting the driver dies or is restarted
 * - A driver hits its wall-clock ceiling
 * - A driver dies between its last task and the final status write
 *
 * For each non-terminal job with a stale heartbeat the reconciler:
 * 1. Repairs counters from task rows
 * 2. Finalizes the job if nothing is pending
 * 3. Otherwise clears the stale lease and starts a fresh driver, which only sees
 * the remaining pending tasks
 */
public class Reconciler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    public static final String FUNCTION = "batch-reconciler";

    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final PromptCatalog catalog;
    private final TaskMatrixBuilder matrixBuilder;
    private final DriverLauncher launcher;
    private final RunRecorder recorder;
    private final EngineConfig config;

    public Reconciler(JobRepository jobRepository, TaskRepository taskRepository, PromptCatalog catalog,
            TaskMatrixBuilder matrixBuilder, DriverLauncher launcher, RunRecorder recorder, EngineConfig config) {
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.catalog = catalog;
        this.matrixBuilder = matrixBuilder;
        this.launcher = launcher;
        this.recorder = recorder;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reconcile("scheduler");
        } catch (Exception e) {
            log.error("Reconciler error", e);
        }
    }

    /**
     * Scan for stale jobs and finalize or resume each one.
     *
     * @param triggerSource who asked for the sweep
     * @return what was done
     */
    public ReconcileReport reconcile(String triggerSource) {
        Instant now = config.clock().instant();
        Instant staleBefore = now.minus(config.staleThreshold());

        List<BatchJob> stale = jobRepository.findStale(staleBefore, config.reconcileScanLimit());
        if (stale.isEmpty()) {
            log.debug("No stale jobs found");
            return new ReconcileReport(null, 0, List.of(), List.of(), List.of());
        }

        String runId = recorder.start(null, FUNCTION, triggerSource);
        List<String> finalized = new ArrayList<>();
        List<String> resumed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (BatchJob job : stale) {
            try {
                switch (reconcileJob(job, staleBefore)) {
                    case FINALIZED -> finalized.add(job.id());
                    case RESUMED -> resumed.add(job.id());
                    case SKIPPED -> skipped.add(job.id());
                }
            } catch (RuntimeException e) {
                log.error("Failed to reconcile job {}", job.id(), e);
                skipped.add(job.id());
            }
        }

        ReconcileReport report = new ReconcileReport(runId, stale.size(), finalized, resumed, skipped);
        recorder.finish(runId, SchedulerRun.COMPLETED, report);
        log.info("Reconciler: {} stale, {} finalized, {} resumed, {} skipped",
                stale.size(), finalized.size(), resumed.size(), skipped.size());
        return report;
    }

    private enum Action {
        FINALIZED, RESUMED, SKIPPED
    }

    private Action reconcileJob(BatchJob job, Instant staleBefore) {
        if (launcher.isRunning(job.id())) {
            log.warn("Job {} looks stale but its driver is still running here", job.id());
            return Action.SKIPPED;
        }

        // Trigger died between creating the job and building its matrix
        if (!job.isMatrixBuilt()) {
            Optional<Organization> org = catalog.findOrganization(job.orgId());
            if (org.isEmpty()) {
                jobRepository.finish(job.id(), JobStatus.FAILED, "Organization " + job.orgId() + " no longer exists",
                        config.clock().instant());
                return Action.FINALIZED;
            }
            TaskMatrixBuilder.MatrixResult matrix = matrixBuilder.build(job, org.get());
            if (matrix.finalized()) {
                return Action.FINALIZED;
            }
        }

        jobRepository.syncCountersFromTasks(job.id());
        BatchJob current = jobRepository.findById(job.id()).orElseThrow();
        if (current.isTerminal()) {
            return Action.SKIPPED;
        }

        int pending = taskRepository.countByJobIdAndStatus(job.id(), TaskStatus.PENDING);
        if (pending == 0 || current.isDrained()) {
            Optional<String> unservable = BatchDriver.unservableReason(taskRepository.findByJobId(job.id()));
            JobStatus status = unservable.isPresent() ? JobStatus.FAILED : JobStatus.COMPLETED;
            boolean done = jobRepository.finish(job.id(), status, unservable.orElse(null), config.clock().instant());
            if (done) {
                log.info("Job {} was drained but never closed, finalized as {} ({}/{} completed, {} failed)",
                        job.id(), status, current.completedTasks(), current.totalTasks(), current.failedTasks());
            }
            return done ? Action.FINALIZED : Action.SKIPPED;
        }

        jobRepository.clearStaleLease(job.id(), staleBefore);
        launcher.launch(job.id());
        log.info("Job {} resumed: {} pending tasks, last ping {}", job.id(), pending, current.driverLastPing());
        return Action.RESUMED;
    }
}
