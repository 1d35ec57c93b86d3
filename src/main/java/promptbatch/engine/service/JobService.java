package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.SchedulerRunRepository;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Operator-facing job operations: monitoring reads, cancellation, manual re-drive.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int MAX_LIMIT = 500;

    public enum CancelResult {
        CANCELLED,
        ALREADY_TERMINAL,
        NOT_FOUND
    }

    public enum DriveResult {
        LAUNCHED,
        ALREADY_RUNNING,
        JOB_TERMINAL,
        NOT_FOUND
    }

    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final SchedulerRunRepository runRepository;
    private final DriverLauncher launcher;
    private final EngineConfig config;

    public JobService(JobRepository jobRepository, TaskRepository taskRepository,
            SchedulerRunRepository runRepository, DriverLauncher launcher, EngineConfig config) {
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.runRepository = runRepository;
        this.launcher = launcher;
        this.config = config;
    }

    public Optional<BatchJob> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Jobs filtered by organization and status, newest first.
     */
    public List<BatchJob> listJobs(String orgId, JobStatus status, int limit) {
        return jobRepository.find(orgId, status, clampLimit(limit));
    }

    public List<BatchTask> getTasks(String jobId) {
        return taskRepository.findByJobId(jobId);
    }

    public List<SchedulerRun> recentRuns(int limit) {
        return runRepository.findRecent(clampLimit(limit));
    }

    public int countNonTerminal() {
        return jobRepository.countNonTerminal();
    }

    public int activeDrivers() {
        return launcher.activeCount();
    }

    /**
     * Cancel a job: the job turns terminal first, so in-flight completions are
     * discarded, then its pending tasks are cancelled.
     */
    public CancelResult cancel(String jobId) {
        Optional<BatchJob> job = jobRepository.findById(jobId);
        if (job.isEmpty()) {
            return CancelResult.NOT_FOUND;
        }
        Instant now = config.clock().instant();
        if (!jobRepository.finish(jobId, JobStatus.CANCELLED, "Cancelled by operator", now)) {
            return CancelResult.ALREADY_TERMINAL;
        }
        int cancelled = taskRepository.cancelPending(jobId, now);
        log.info("Job {} cancelled ({} pending tasks dropped)", jobId, cancelled);
        return CancelResult.CANCELLED;
    }

    /**
     * Start a driver for a non-terminal job.
     */
    public DriveResult drive(String jobId) {
        Optional<BatchJob> job = jobRepository.findById(jobId);
        if (job.isEmpty()) {
            return DriveResult.NOT_FOUND;
        }
        if (job.get().isTerminal()) {
            return DriveResult.JOB_TERMINAL;
        }
        return launcher.launch(jobId) ? DriveResult.LAUNCHED : DriveResult.ALREADY_RUNNING;
    }

    static int clampLimit(int limit) {
        if (limit <= 0) {
            return 50;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
