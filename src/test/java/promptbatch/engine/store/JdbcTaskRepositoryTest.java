package promptbatch.engine.store;

import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.TaskCompleteResult;
import promptbatch.engine.model.TaskFailResult;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.support.TestData;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    private static Database db;
    private static JdbcTaskRepository tasks;
    private static JdbcJobRepository jobs;

    @BeforeAll
    static void setup() {
        db = new Database(TestData.memoryDbUrl("test-tasks"), 4);
        tasks = new JdbcTaskRepository(db);
        jobs = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestData.cleanAll(db);
    }

    private List<BatchTask> seedJob(String jobId, int prompts, int maxAttempts) {
        jobs.insert(TestData.newJob(jobId, "org-" + jobId, "2026-10-19", NOW));
        List<BatchTask> matrix = new ArrayList<>();
        for (int i = 1; i <= prompts; i++) {
            matrix.add(BatchTask.builder()
                    .jobId(jobId)
                    .orgId("org-" + jobId)
                    .promptId("p" + i)
                    .provider("openai")
                    .status(TaskStatus.PENDING)
                    .maxAttempts(maxAttempts)
                    .build());
        }
        assertTrue(tasks.insertMatrix(jobId, matrix, NOW));
        return matrix;
    }

    private BatchJob job(String jobId) {
        return jobs.findById(jobId).orElseThrow();
    }

    @Test
    void insertMatrixFixesTotalOnce() {
        List<BatchTask> matrix = seedJob("job-1", 3, 3);

        assertEquals(3, job("job-1").totalTasks());
        assertNotNull(job("job-1").matrixBuiltAt());
        assertFalse(tasks.insertMatrix("job-1", matrix, NOW), "Second build must be a no-op");
        assertEquals(3, tasks.findByJobId("job-1").size());
        assertEquals(3, job("job-1").totalTasks());
    }

    @Test
    void completeIsIdempotent() {
        BatchTask task = seedJob("job-1", 2, 3).get(0);

        assertEquals(TaskCompleteResult.COMPLETED,
                tasks.completeIdempotent(task.id(), "gpt", "hello", 3, 4, 120, NOW));
        assertEquals(TaskCompleteResult.ALREADY_TERMINAL,
                tasks.completeIdempotent(task.id(), "gpt", "hello again", 3, 4, 120, NOW));

        assertEquals(1, job("job-1").completedTasks(), "Replay must not double-count");
        BatchTask stored = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.status());
        assertEquals("hello", stored.rawResponse());
        assertEquals(4, stored.tokensOut());
    }

    @Test
    void failAfterCompleteIsNoOp() {
        BatchTask task = seedJob("job-1", 1, 3).get(0);
        tasks.completeIdempotent(task.id(), "gpt", "ok", null, null, 10, NOW);

        assertEquals(TaskFailResult.ALREADY_TERMINAL,
                tasks.failIdempotent(task.id(), "HTTP_ERROR", "boom", false, NOW));
        assertEquals(1, job("job-1").completedTasks());
        assertEquals(0, job("job-1").failedTasks());
    }

    @Test
    void retriableFailureReturnsTaskToPoolUntilAttemptsRunOut() {
        BatchTask task = seedJob("job-1", 1, 2).get(0);

        tasks.markDispatched(List.of(task.id()), NOW);
        assertEquals(TaskFailResult.RETRIED, tasks.failIdempotent(task.id(), "TIMEOUT", "slow", true, NOW));
        BatchTask retried = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.PENDING, retried.status());
        assertEquals("TIMEOUT", retried.errorKind());
        assertEquals(0, job("job-1").failedTasks(), "Retry must not touch counters");

        tasks.markDispatched(List.of(task.id()), NOW);
        assertEquals(TaskFailResult.FAILED, tasks.failIdempotent(task.id(), "TIMEOUT", "slow", true, NOW));
        assertEquals(TaskStatus.FAILED, tasks.findById(task.id()).orElseThrow().status());
        assertEquals(2, tasks.findById(task.id()).orElseThrow().attempts());
        assertEquals(1, job("job-1").failedTasks());
    }

    @Test
    void nonRetriableFailureIsFinalOnFirstAttempt() {
        BatchTask task = seedJob("job-1", 1, 3).get(0);
        tasks.markDispatched(List.of(task.id()), NOW);

        assertEquals(TaskFailResult.FAILED, tasks.failIdempotent(task.id(), "AUTH", "bad key", false, NOW));
        assertEquals(1, job("job-1").failedTasks());
    }

    @Test
    void writesAfterJobTerminalAreDiscarded() {
        List<BatchTask> matrix = seedJob("job-1", 2, 3);
        assertTrue(jobs.finish("job-1", JobStatus.CANCELLED, "stop", NOW));

        assertEquals(TaskCompleteResult.JOB_TERMINAL,
                tasks.completeIdempotent(matrix.get(0).id(), "gpt", "late", null, null, 1, NOW));
        assertEquals(TaskFailResult.JOB_TERMINAL,
                tasks.failIdempotent(matrix.get(1).id(), "HTTP_ERROR", "late", false, NOW));

        BatchJob job = job("job-1");
        assertEquals(0, job.completedTasks());
        assertEquals(0, job.failedTasks());
        assertEquals(TaskStatus.PENDING, tasks.findById(matrix.get(0).id()).orElseThrow().status());
    }

    @Test
    void unknownTaskIsNotFound() {
        assertEquals(TaskCompleteResult.NOT_FOUND,
                tasks.completeIdempotent("nope", "gpt", "x", null, null, 1, NOW));
        assertEquals(TaskFailResult.NOT_FOUND, tasks.failIdempotent("nope", "AUTH", "x", false, NOW));
    }

    @Test
    void findPendingSkipsTerminalTasksAndPrefersFewerAttempts() {
        List<BatchTask> matrix = seedJob("job-1", 4, 3);
        tasks.completeIdempotent(matrix.get(0).id(), "gpt", "ok", null, null, 1, NOW);
        tasks.markDispatched(List.of(matrix.get(1).id()), NOW);

        List<BatchTask> pending = tasks.findPending("job-1", 10);
        assertEquals(3, pending.size());
        assertEquals(1, pending.get(2).attempts(), "Already attempted task goes last");
        assertTrue(pending.stream().noneMatch(t -> t.id().equals(matrix.get(0).id())));

        assertEquals(2, tasks.findPending("job-1", 2).size());
    }

    @Test
    void cancelPendingLeavesTerminalTasksAlone() {
        List<BatchTask> matrix = seedJob("job-1", 3, 3);
        tasks.completeIdempotent(matrix.get(0).id(), "gpt", "ok", null, null, 1, NOW);

        assertEquals(2, tasks.cancelPending("job-1", NOW));

        Map<TaskStatus, Integer> counts = tasks.countByStatus("job-1");
        assertEquals(1, counts.get(TaskStatus.COMPLETED));
        assertEquals(2, counts.get(TaskStatus.CANCELLED));
        assertEquals(0, tasks.countByJobIdAndStatus("job-1", TaskStatus.PENDING));
        assertTrue(tasks.findPending("job-1", 10).isEmpty());
    }

    @Test
    void countersNeverExceedTotal() {
        List<BatchTask> matrix = seedJob("job-1", 3, 1);
        for (BatchTask t : matrix) {
            tasks.markDispatched(List.of(t.id()), NOW);
            tasks.failIdempotent(t.id(), "HTTP_ERROR", "x", true, NOW);
            tasks.completeIdempotent(t.id(), "gpt", "x", null, null, 1, NOW);
        }

        BatchJob job = job("job-1");
        assertEquals(3, job.failedTasks());
        assertEquals(0, job.completedTasks());
        assertTrue(job.isDrained());
    }
}
