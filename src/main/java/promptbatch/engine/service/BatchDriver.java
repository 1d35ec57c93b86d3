package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.LeaseResult;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.provider.ProviderErrorKind;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The execution loop of one job, for one driver instance.
 *
 * <p>
 * Claims the job's soft lease, then repeatedly takes a slice of pending tasks, runs
 * them concurrently and waits for the whole slice to settle, heartbeats, and pauses.
 * When no pending task is left the job is finalized. The loop stops early when the
 * lease is lost, the wall-clock ceiling is reached, the job turns terminal under it,
 * or the job can no longer succeed at all.
 * </p>
 */
public class BatchDriver {

    private static final Logger log = LoggerFactory.getLogger(BatchDriver.class);

    public enum Outcome {
        /** Drained and marked COMPLETED */
        FINALIZED,
        /** Marked FAILED: organization ineligible, or every provider unusable */
        FAILED,
        /** Another driver's heartbeat was fresh */
        NOT_CLAIMED,
        /** Job was already terminal, or turned terminal while running */
        JOB_TERMINAL,
        /** Heartbeat rejected; another driver took over */
        LEASE_LOST,
        /** Wall-clock ceiling reached; left for the reconciler */
        CEILING_REACHED,
        INTERRUPTED,
        NOT_FOUND
    }

    public record Result(String jobId, String driverId, Outcome outcome, int slices, int dispatched) {
    }

    private final String jobId;
    private final String driverId;
    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final PromptCatalog catalog;
    private final TaskExecutor executor;
    private final TaskMatrixBuilder matrixBuilder;
    private final EngineConfig config;
    private final Clock clock;

    private int slices;
    private int dispatched;

    public BatchDriver(String jobId, JobRepository jobRepository, TaskRepository taskRepository,
            PromptCatalog catalog, TaskExecutor executor, TaskMatrixBuilder matrixBuilder, EngineConfig config) {
        this.jobId = jobId;
        this.driverId = "drv-" + UUID.randomUUID();
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.catalog = catalog;
        this.executor = executor;
        this.matrixBuilder = matrixBuilder;
        this.config = config;
        this.clock = config.clock();
    }

    public String driverId() {
        return driverId;
    }

    /**
     * Run the loop to its end. Task errors never escape; store errors do.
     */
    public Result run() {
        Instant startedAt = clock.instant();

        // CLAIMING
        LeaseResult lease = jobRepository.tryAcquireLease(jobId, driverId, startedAt,
                startedAt.minus(config.leaseLivenessWindow()));
        switch (lease) {
            case CLAIMED -> {
            }
            case HELD_BY_OTHER -> {
                log.info("Job {} is held by a live driver, {} stands down", jobId, driverId);
                return result(Outcome.NOT_CLAIMED);
            }
            case JOB_TERMINAL -> {
                return result(Outcome.JOB_TERMINAL);
            }
            default -> {
                log.warn("Job {} not found, driver {} stops", jobId, driverId);
                return result(Outcome.NOT_FOUND);
            }
        }

        try {
            return loop(startedAt.plus(config.driverCeiling()));
        } finally {
            jobRepository.releaseLease(jobId, driverId);
        }
    }

    private Result loop(Instant deadline) {
        BatchJob job = jobRepository.findById(jobId).orElseThrow();

        // The trigger stopped between creating the job and expanding it
        if (!job.isMatrixBuilt()) {
            Optional<String> ineligible = checkOrganization(job.orgId());
            if (ineligible.isPresent()) {
                return failJob(ineligible.get());
            }
            Organization org = catalog.findOrganization(job.orgId()).orElseThrow();
            TaskMatrixBuilder.MatrixResult matrix = matrixBuilder.build(job, org);
            if (matrix.finalized()) {
                return result(Outcome.FINALIZED);
            }
            job = jobRepository.findById(jobId).orElseThrow();
            if (job.isTerminal()) {
                return result(Outcome.JOB_TERMINAL);
            }
        }

        // Seed from earlier drivers of the same job
        Set<String> jobProviders = new TreeSet<>();
        Set<String> fatalProviders = new LinkedHashSet<>();
        boolean anyCompleted = false;
        for (BatchTask task : taskRepository.findByJobId(jobId)) {
            jobProviders.add(task.provider());
            anyCompleted |= task.status() == TaskStatus.COMPLETED;
            if (failedOnFatalProvider(task)) {
                fatalProviders.add(task.provider());
            }
        }
        Optional<String> unservable = unservableReason(jobProviders, fatalProviders, anyCompleted);
        if (unservable.isPresent()) {
            return failJob(unservable.get());
        }

        // RUNNING
        while (true) {
            Optional<String> ineligible = checkOrganization(job.orgId());
            if (ineligible.isPresent()) {
                return failJob(ineligible.get());
            }

            if (!clock.instant().isBefore(deadline)) {
                log.warn("Driver {} reached the {} ceiling on job {}, handing off to the reconciler",
                        driverId, config.driverCeiling(), jobId);
                return result(Outcome.CEILING_REACHED);
            }

            List<BatchTask> slice = taskRepository.findPending(jobId, config.sliceSize());
            if (slice.isEmpty()) {
                return drain();
            }

            List<TaskOutcome> outcomes = runSlice(slice);
            if (outcomes == null) {
                return result(Outcome.INTERRUPTED);
            }

            int completed = 0;
            int failed = 0;
            int retried = 0;
            for (TaskOutcome outcome : outcomes) {
                switch (outcome.status()) {
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case RETRY_SCHEDULED -> retried++;
                    default -> {
                    }
                }
                if (outcome.providerFatal()) {
                    fatalProviders.add(outcome.task().provider());
                }
            }
            anyCompleted |= completed > 0;
            log.info("Job {} slice {}: {} completed, {} failed, {} to retry", jobId, slices, completed, failed,
                    retried);

            unservable = unservableReason(jobProviders, fatalProviders, anyCompleted);
            if (unservable.isPresent()) {
                return failJob(unservable.get());
            }

            if (!jobRepository.heartbeat(jobId, driverId, clock.instant(), true)) {
                Optional<BatchJob> current = jobRepository.findById(jobId);
                if (current.isEmpty() || current.get().isTerminal()) {
                    log.info("Job {} turned terminal under driver {}", jobId, driverId);
                    return result(Outcome.JOB_TERMINAL);
                }
                log.warn("Driver {} lost the lease on job {} to {}", driverId, jobId, current.get().driverId());
                return result(Outcome.LEASE_LOST);
            }

            if (!pause()) {
                return result(Outcome.INTERRUPTED);
            }
        }
    }

    /**
     * Fan out one slice and wait for every task to settle, heartbeating while waiting.
     *
     * @return outcomes in slice order, or null if interrupted
     */
    private List<TaskOutcome> runSlice(List<BatchTask> slice) {
        slices++;
        List<String> ids = new ArrayList<>(slice.size());
        List<String> promptIds = new ArrayList<>(slice.size());
        for (BatchTask task : slice) {
            ids.add(task.id());
            promptIds.add(task.promptId());
        }
        Map<String, String> texts = catalog.findPromptTexts(promptIds);
        dispatched += taskRepository.markDispatched(ids, clock.instant());

        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>(slice.size());
        for (BatchTask task : slice) {
            futures.add(executor.submit(task, texts.get(task.promptId())));
        }

        CompletableFuture<Void> barrier = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        long keepAliveMs = Math.max(1, config.leaseLivenessWindow().toMillis() / 3);
        while (true) {
            try {
                barrier.get(keepAliveMs, TimeUnit.MILLISECONDS);
                break;
            } catch (TimeoutException e) {
                jobRepository.heartbeat(jobId, driverId, clock.instant(), false);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } catch (ExecutionException e) {
                // outcomes never complete exceptionally
                log.error("Unexpected slice failure on job {}", jobId, e);
                break;
            }
        }

        List<TaskOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(futures.get(i).getNow(TaskOutcome.discarded(slice.get(i), "not settled")));
        }
        return outcomes;
    }

    private Result drain() {
        // DRAINED
        jobRepository.syncCountersFromTasks(jobId);
        if (jobRepository.finish(jobId, JobStatus.COMPLETED, null, clock.instant())) {
            BatchJob done = jobRepository.findById(jobId).orElseThrow();
            log.info("Job {} drained: {}/{} completed, {}/{} failed", jobId,
                    done.completedTasks(), done.totalTasks(), done.failedTasks(), done.totalTasks());
            return result(Outcome.FINALIZED);
        }
        return result(Outcome.JOB_TERMINAL);
    }

    private Result failJob(String reason) {
        Instant now = clock.instant();
        if (jobRepository.finish(jobId, JobStatus.FAILED, reason, now)) {
            taskRepository.cancelPending(jobId, now);
            log.error("Job {} failed: {}", jobId, reason);
            return result(Outcome.FAILED);
        }
        return result(Outcome.JOB_TERMINAL);
    }

    /**
     * Reason to fail a job whose tasks, as persisted, show that every provider of the job
     * rejected its credentials or is not configured, with nothing completed.
     */
    public static Optional<String> unservableReason(List<BatchTask> tasks) {
        Set<String> jobProviders = new TreeSet<>();
        Set<String> fatalProviders = new LinkedHashSet<>();
        boolean anyCompleted = false;
        for (BatchTask task : tasks) {
            jobProviders.add(task.provider());
            anyCompleted |= task.status() == TaskStatus.COMPLETED;
            if (failedOnFatalProvider(task)) {
                fatalProviders.add(task.provider());
            }
        }
        return unservableReason(jobProviders, fatalProviders, anyCompleted);
    }

    private static Optional<String> unservableReason(Set<String> jobProviders, Set<String> fatalProviders,
            boolean anyCompleted) {
        if (anyCompleted || jobProviders.isEmpty() || !fatalProviders.containsAll(jobProviders)) {
            return Optional.empty();
        }
        return Optional.of("No provider can serve this job: " + String.join(", ", fatalProviders));
    }

    static boolean failedOnFatalProvider(BatchTask task) {
        if (task.status() != TaskStatus.FAILED || task.errorKind() == null) {
            return false;
        }
        for (ProviderErrorKind kind : ProviderErrorKind.values()) {
            if (kind.providerFatal() && kind.name().equals(task.errorKind())) {
                return true;
            }
        }
        return false;
    }

    private Optional<String> checkOrganization(String orgId) {
        Optional<Organization> org = catalog.findOrganization(orgId);
        if (org.isEmpty()) {
            return Optional.of("Organization " + orgId + " no longer exists");
        }
        if (!org.get().hasAccess(clock.instant())) {
            return Optional.of("Organization " + orgId + " has no active subscription");
        }
        return Optional.empty();
    }

    private boolean pause() {
        Duration pause = config.slicePause();
        if (pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Result result(Outcome outcome) {
        return new Result(jobId, driverId, outcome, slices, dispatched);
    }
}
