package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.TaskKey;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.provider.ProviderErrorKind;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.provider.ProviderResponse;
import promptbatch.engine.store.Database;
import promptbatch.engine.store.JdbcJobRepository;
import promptbatch.engine.store.JdbcTaskRepository;
import promptbatch.engine.support.FakeProvider;
import promptbatch.engine.support.MutableClock;
import promptbatch.engine.support.TestData;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TaskExecutorTest {

    private static EngineConfig config;
    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcTaskRepository tasks;

    private TaskExecutor executor;

    @BeforeAll
    static void setup() {
        config = TestData.config("test-executor", new MutableClock(TestData.IN_WINDOW))
                .withProviderTimeout(Duration.ofMillis(300));
        db = new Database(config);
        jobs = new JdbcJobRepository(db);
        tasks = new JdbcTaskRepository(db);
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

    @AfterEach
    void closeExecutor() {
        if (executor != null)
            executor.close();
    }

    private BatchTask dispatchedTask(String provider) {
        jobs.insert(TestData.newJob("job-1", "org-a", "2026-10-19", TestData.IN_WINDOW));
        BatchTask task = BatchTask.builder()
                .jobId("job-1")
                .orgId("org-a")
                .promptId("p1")
                .provider(provider)
                .status(TaskStatus.PENDING)
                .maxAttempts(3)
                .build();
        tasks.insertMatrix("job-1", List.of(task), TestData.IN_WINDOW);
        tasks.markDispatched(List.of(task.id()), TestData.IN_WINDOW);
        return tasks.findById(task.id()).orElseThrow();
    }

    @Test
    void successIsRecordedAndHandedOff() throws Exception {
        CountDownLatch handedOff = new CountDownLatch(1);
        AtomicReference<TaskKey> seenKey = new AtomicReference<>();
        executor = new TaskExecutor(tasks, new ProviderRegistry().register(FakeProvider.answering("openai")),
                (key, response) -> {
                    seenKey.set(key);
                    handedOff.countDown();
                }, config);
        BatchTask task = dispatchedTask("openai");

        TaskOutcome outcome = executor.execute(task, "what is java");

        assertEquals(TaskOutcome.Status.COMPLETED, outcome.status());
        BatchTask stored = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.status());
        assertEquals("answer to: what is java", stored.rawResponse());
        assertEquals("openai-model", stored.model());
        assertEquals(10, stored.tokensIn());
        assertNotNull(stored.runtimeMs());
        assertEquals(1, jobs.findById("job-1").orElseThrow().completedTasks());

        assertTrue(handedOff.await(5, TimeUnit.SECONDS), "Response should be handed off");
        assertEquals(task.key(), seenKey.get());
    }

    @Test
    void handoffFailureDoesNotAffectTask() {
        executor = new TaskExecutor(tasks, new ProviderRegistry().register(FakeProvider.answering("openai")),
                (key, response) -> {
                    throw new IllegalStateException("analysis down");
                }, config);
        BatchTask task = dispatchedTask("openai");

        assertEquals(TaskOutcome.Status.COMPLETED, executor.execute(task, "hi").status());
        assertEquals(TaskStatus.COMPLETED, tasks.findById(task.id()).orElseThrow().status());
    }

    @Test
    void timeoutIsRetriable() {
        executor = new TaskExecutor(tasks,
                new ProviderRegistry().register(FakeProvider.hanging("gemini", Duration.ofSeconds(3))),
                ResponseHandoff.none(), config);
        BatchTask task = dispatchedTask("gemini");

        long start = System.nanoTime();
        TaskOutcome outcome = executor.execute(task, "slow prompt");
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(TaskOutcome.Status.RETRY_SCHEDULED, outcome.status());
        assertEquals(ProviderErrorKind.TIMEOUT, outcome.errorKind());
        assertTrue(elapsedMs < 2500, "Call must be abandoned at the timeout, took " + elapsedMs + " ms");
        BatchTask stored = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.PENDING, stored.status());
        assertEquals("TIMEOUT", stored.errorKind());
    }

    @Test
    void authFailureIsFinalAndProviderFatal() {
        executor = new TaskExecutor(tasks,
                new ProviderRegistry().register(FakeProvider.failing("claude", ProviderErrorKind.AUTH)),
                ResponseHandoff.none(), config);
        BatchTask task = dispatchedTask("claude");

        TaskOutcome outcome = executor.execute(task, "hi");

        assertEquals(TaskOutcome.Status.FAILED, outcome.status());
        assertTrue(outcome.providerFatal());
        assertEquals(1, jobs.findById("job-1").orElseThrow().failedTasks());
    }

    @Test
    void unknownProviderFailsAsNotConfigured() {
        executor = new TaskExecutor(tasks, new ProviderRegistry(), ResponseHandoff.none(), config);
        BatchTask task = dispatchedTask("mistral");

        TaskOutcome outcome = executor.execute(task, "hi");

        assertEquals(TaskOutcome.Status.FAILED, outcome.status());
        assertEquals(ProviderErrorKind.NOT_CONFIGURED, outcome.errorKind());
    }

    @Test
    void missingPromptFailsWithoutCallingProvider() {
        FakeProvider openai = FakeProvider.answering("openai");
        executor = new TaskExecutor(tasks, new ProviderRegistry().register(openai), ResponseHandoff.none(), config);
        BatchTask task = dispatchedTask("openai");

        TaskOutcome outcome = executor.execute(task, null);

        assertEquals(TaskOutcome.Status.FAILED, outcome.status());
        assertFalse(outcome.providerFatal());
        assertEquals(0, openai.callCount());
        assertEquals(TaskExecutor.PROMPT_MISSING, tasks.findById(task.id()).orElseThrow().errorKind());
    }

    @Test
    void lateCompletionOfTerminalTaskIsDiscarded() {
        executor = new TaskExecutor(tasks, new ProviderRegistry().register(new FakeProvider("openai",
                (n, prompt, call) -> new ProviderResponse("dup", "m", null, null))), ResponseHandoff.none(), config);
        BatchTask task = dispatchedTask("openai");
        tasks.completeIdempotent(task.id(), "m", "first", null, null, 1, TestData.IN_WINDOW);

        assertEquals(TaskOutcome.Status.DISCARDED, executor.execute(task, "hi").status());
        assertEquals("first", tasks.findById(task.id()).orElseThrow().rawResponse());
        assertEquals(1, jobs.findById("job-1").orElseThrow().completedTasks());
    }
}
