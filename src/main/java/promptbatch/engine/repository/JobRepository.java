package promptbatch.engine.repository;

import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.LeaseResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BatchJob persistence.
 * Jobs are never deleted; they stay as the audit trail of past runs.
 */
public interface JobRepository {

    /**
     * Insert a new job.
     *
     * @param job the job to save
     * @return false if the organization already has a job for this window or a
     *         non-terminal job (nothing written)
     */
    boolean insert(BatchJob job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<BatchJob> findById(String jobId);

    /**
     * Find the organization's job for one run window.
     */
    Optional<BatchJob> findByOrgAndRunKey(String orgId, String runKey);

    /**
     * Find the organization's non-terminal job, whatever its window.
     */
    Optional<BatchJob> findActiveByOrg(String orgId);

    /**
     * All jobs of one run window.
     */
    List<BatchJob> findByRunKey(String runKey);

    /**
     * Monitoring query, newest first.
     *
     * @param orgId  organization filter, null for all
     * @param status status filter, null for all
     * @param limit  maximum results
     * @return list of jobs
     */
    List<BatchJob> find(String orgId, JobStatus status, int limit);

    /**
     * Non-terminal jobs whose driver has gone quiet: last ping before the cutoff, or
     * never pinged and created before the cutoff.
     *
     * @param staleBefore cutoff timestamp
     * @param limit       maximum results
     * @return list of jobs, oldest first
     */
    List<BatchJob> findStale(Instant staleBefore, int limit);

    int countNonTerminal();

    /**
     * Claim the soft lease for a driver. Succeeds when no driver is active, the active
     * driver's last ping is older than {@code freshAfter}, or the caller already holds it.
     * On success the job moves to PROCESSING and started_at is set if still null.
     *
     * @param jobId      the job ID
     * @param driverId   the claiming driver
     * @param now        heartbeat timestamp to write
     * @param freshAfter pings at or after this instant count as alive
     * @return claim outcome
     */
    LeaseResult tryAcquireLease(String jobId, String driverId, Instant now, Instant freshAfter);

    /**
     * Refresh the heartbeat.
     *
     * @param iteration true at the end of a driver loop iteration, which also bumps run_count
     * @return false if the caller no longer holds the lease or the job is terminal
     */
    boolean heartbeat(String jobId, String driverId, Instant now, boolean iteration);

    /**
     * Drop the lease if the caller still holds it.
     */
    void releaseLease(String jobId, String driverId);

    /**
     * Clear driver_active on a non-terminal job whose last ping is older than the cutoff.
     *
     * @return true if the flag was cleared (or was already clear)
     */
    boolean clearStaleLease(String jobId, Instant staleBefore);

    /**
     * Move a non-terminal job to a terminal status, setting finished_at exactly once.
     *
     * @param jobId        the job ID
     * @param status       COMPLETED, FAILED or CANCELLED
     * @param errorMessage reason, may be null
     * @param now          finish timestamp
     * @return false if the job was already terminal
     */
    boolean finish(String jobId, JobStatus status, String errorMessage, Instant now);

    /**
     * Raise completed/failed counters to the number of COMPLETED/FAILED task rows.
     * Counters never decrease.
     *
     * @return true if any counter changed
     */
    boolean syncCountersFromTasks(String jobId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-{uuid}"
     */
    String generateId();
}
