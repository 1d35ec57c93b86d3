package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.model.TrackedPrompt;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands an organization's active prompts x providers into the task list of one job.
 * Building twice for the same job is a no-op.
 */
public class TaskMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskMatrixBuilder.class);

    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final PromptCatalog catalog;
    private final EngineConfig config;

    public TaskMatrixBuilder(JobRepository jobRepository, TaskRepository taskRepository, PromptCatalog catalog,
            EngineConfig config) {
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * Result of a build call.
     *
     * @param built     false if the job already had a matrix
     * @param finalized true if the job had nothing to run and was closed as COMPLETED
     */
    public record MatrixResult(String jobId, int totalTasks, boolean built, boolean finalized) {
    }

    /**
     * Build the matrix for a job.
     *
     * @param job the job, freshly created or loaded
     * @param org the job's organization
     * @return result with the job's fixed total
     */
    public MatrixResult build(BatchJob job, Organization org) {
        if (job.isMatrixBuilt()) {
            return new MatrixResult(job.id(), job.totalTasks(), false, false);
        }

        List<TrackedPrompt> prompts = catalog.findActivePrompts(org.id());
        int quota = org.tier().promptsPerDay();
        if (prompts.size() > quota) {
            log.info("Org {} has {} active prompts, {} tier runs the first {}",
                    org.id(), prompts.size(), org.tier(), quota);
            prompts = prompts.subList(0, quota);
        }

        List<BatchTask> tasks = expand(job.id(), org.id(), prompts, org.effectiveProviders(),
                config.maxTaskAttempts());

        Instant now = config.clock().instant();
        if (!taskRepository.insertMatrix(job.id(), tasks, now)) {
            BatchJob current = jobRepository.findById(job.id()).orElse(job);
            log.debug("Matrix for job {} already built ({} tasks)", job.id(), current.totalTasks());
            return new MatrixResult(job.id(), current.totalTasks(), false, false);
        }

        log.info("Built matrix for job {}: {} prompts x {} providers = {} tasks",
                job.id(), prompts.size(), org.effectiveProviders().size(), tasks.size());

        boolean finalized = false;
        if (tasks.isEmpty()) {
            finalized = jobRepository.finish(job.id(), JobStatus.COMPLETED, null, now);
            log.info("Job {} has no tasks (org {} has no active prompts or providers), completed immediately",
                    job.id(), org.id());
        }
        return new MatrixResult(job.id(), tasks.size(), true, finalized);
    }

    /**
     * Cross product of prompts and providers, in prompt order then provider order.
     * Task ids derive from the (job, prompt, provider) triple.
     */
    public static List<BatchTask> expand(String jobId, String orgId, List<TrackedPrompt> prompts,
            List<String> providers, int maxAttempts) {
        List<BatchTask> tasks = new ArrayList<>(prompts.size() * providers.size());
        for (TrackedPrompt prompt : prompts) {
            for (String provider : providers) {
                tasks.add(BatchTask.builder()
                        .jobId(jobId)
                        .orgId(orgId)
                        .promptId(prompt.id())
                        .provider(provider)
                        .status(TaskStatus.PENDING)
                        .maxAttempts(maxAttempts)
                        .build());
            }
        }
        return tasks;
    }
}
