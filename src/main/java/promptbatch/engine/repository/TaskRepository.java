package promptbatch.engine.repository;

import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.TaskCompleteResult;
import promptbatch.engine.model.TaskFailResult;
import promptbatch.engine.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for BatchTask persistence.
 * Every state transition that moves a job counter runs in the same transaction as
 * the counter update and is guarded on the task still being PENDING, so each task
 * triple moves a counter at most once.
 */
public interface TaskRepository {

    /**
     * Insert the full task matrix and fix the job's total_tasks, atomically.
     *
     * @param jobId the job ID
     * @param tasks all tasks of the job
     * @param now   build timestamp
     * @return false if the job already had a matrix (nothing written)
     */
    boolean insertMatrix(String jobId, List<BatchTask> tasks, Instant now);

    /**
     * Find a task by ID.
     */
    Optional<BatchTask> findById(String taskId);

    /**
     * Find all tasks for a job.
     */
    List<BatchTask> findByJobId(String jobId);

    /**
     * Next PENDING tasks of a job, least-attempted first.
     *
     * @param jobId the job ID
     * @param limit slice size
     * @return list of tasks
     */
    List<BatchTask> findPending(String jobId, int limit);

    /**
     * Record a dispatch: attempts + 1 and started_at, for tasks still PENDING.
     *
     * @return number of tasks updated
     */
    int markDispatched(List<String> taskIds, Instant now);

    /**
     * Complete a task and increment the job's completed_tasks in one transaction.
     *
     * @param taskId      the task ID
     * @param model       provider model that answered
     * @param rawResponse raw response text
     * @param tokensIn    prompt tokens, may be null
     * @param tokensOut   completion tokens, may be null
     * @param runtimeMs   call duration
     * @param now         finish timestamp
     * @return detailed result indicating outcome
     */
    TaskCompleteResult completeIdempotent(String taskId, String model, String rawResponse,
            Integer tokensIn, Integer tokensOut, long runtimeMs, Instant now);

    /**
     * Report a failed attempt. If retriable and attempts &lt; maxAttempts the task goes
     * back to PENDING with the error recorded and counters untouched; otherwise it is
     * marked FAILED and the job's failed_tasks is incremented in the same transaction.
     *
     * @param taskId       the task ID
     * @param errorKind    error category
     * @param errorMessage the error message
     * @param retriable    whether the failure is retriable
     * @param now          timestamp
     * @return detailed result indicating outcome
     */
    TaskFailResult failIdempotent(String taskId, String errorKind, String errorMessage, boolean retriable,
            Instant now);

    /**
     * Mark every PENDING task of a job CANCELLED.
     *
     * @return number of tasks cancelled
     */
    int cancelPending(String jobId, Instant now);

    /**
     * Count tasks by status for a job.
     */
    int countByJobIdAndStatus(String jobId, TaskStatus status);

    /**
     * Task counts per status for a job (statuses with no tasks are absent).
     */
    Map<TaskStatus, Integer> countByStatus(String jobId);
}
