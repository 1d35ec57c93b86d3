package promptbatch.engine.service;

import promptbatch.engine.config.Dependencies;
import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.LeaseResult;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.SubscriptionTier;
import promptbatch.engine.model.TaskStatus;
import promptbatch.engine.provider.ProviderErrorKind;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.support.FakeProvider;
import promptbatch.engine.support.MutableClock;
import promptbatch.engine.support.TestData;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchDriverTest {

    private MutableClock clock;
    private Dependencies deps;

    @BeforeEach
    void setup() {
        clock = new MutableClock(TestData.IN_WINDOW);
    }

    @AfterEach
    void teardown() {
        if (deps != null)
            deps.close();
    }

    private void start(EngineConfig config, FakeProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry();
        for (FakeProvider p : providers) {
            registry.register(p);
        }
        deps = Dependencies.create(config, registry, ResponseHandoff.none());
    }

    private EngineConfig config() {
        return TestData.config("test-driver", clock).withSliceSize(4);
    }

    private String jobFor(Organization org, int prompts) {
        TestData.seed(deps.promptCatalog(), org, prompts);
        BatchJob job = TestData.newJob("job-" + org.id(), org.id(), "2026-10-19", clock.instant());
        assertTrue(deps.jobRepository().insert(job));
        deps.matrixBuilder().build(job, org);
        return job.id();
    }

    private BatchJob job(String id) {
        return deps.jobRepository().findById(id).orElseThrow();
    }

    @Test
    void drainsJobSliceBySliceAndFinalizes() {
        FakeProvider openai = FakeProvider.answering("openai");
        FakeProvider gemini = FakeProvider.answering("gemini");
        start(config(), openai, gemini);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.GROWTH, "openai", "gemini"), 3);

        BatchDriver.Result result = deps.driverLauncher().runNow(jobId);

        assertEquals(BatchDriver.Outcome.FINALIZED, result.outcome());
        assertEquals(2, result.slices(), "6 tasks in slices of 4");
        assertEquals(6, result.dispatched());
        BatchJob done = job(jobId);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(6, done.completedTasks());
        assertEquals(0, done.failedTasks());
        assertEquals(100, done.progressPercent());
        assertEquals(2, done.runCount());
        assertFalse(done.driverActive(), "Lease is released");
        assertNotNull(done.finishedAt());
        assertEquals(3, openai.callCount());
        assertEquals(3, gemini.callCount());
    }

    @Test
    void retriableFailuresAreRetriedInLaterSlices() {
        FakeProvider openai = FakeProvider.flaky("openai", 2);
        start(config(), openai);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 1);

        BatchDriver.Result result = deps.driverLauncher().runNow(jobId);

        assertEquals(BatchDriver.Outcome.FINALIZED, result.outcome());
        assertEquals(3, openai.callCount());
        assertEquals(1, job(jobId).completedTasks());
        assertEquals(3, deps.taskRepository().findByJobId(jobId).get(0).attempts());
    }

    @Test
    void exhaustedRetriesCountAsFailedTasks() {
        start(config(), FakeProvider.failing("openai", ProviderErrorKind.HTTP_ERROR));
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 2);

        assertEquals(BatchDriver.Outcome.FINALIZED, deps.driverLauncher().runNow(jobId).outcome());

        BatchJob done = job(jobId);
        assertEquals(JobStatus.COMPLETED, done.status(), "Failed tasks still drain the job");
        assertEquals(2, done.failedTasks());
        assertEquals(0, done.completedTasks());
        assertTrue(deps.taskRepository().findByJobId(jobId).stream().allMatch(t -> t.attempts() == 3));
    }

    @Test
    void jobFailsWhenEveryProviderIsUnusable() {
        FakeProvider openai = FakeProvider.failing("openai", ProviderErrorKind.AUTH);
        start(config().withSliceSize(2), openai);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 5);

        BatchDriver.Result result = deps.driverLauncher().runNow(jobId);

        assertEquals(BatchDriver.Outcome.FAILED, result.outcome());
        assertEquals(2, openai.callCount(), "Stops after the first slice");
        BatchJob failed = job(jobId);
        assertEquals(JobStatus.FAILED, failed.status());
        assertNotNull(failed.errorMessage());
        Map<TaskStatus, Integer> counts = deps.taskRepository().countByStatus(jobId);
        assertEquals(2, counts.get(TaskStatus.FAILED));
        assertEquals(3, counts.get(TaskStatus.CANCELLED));
    }

    @Test
    void oneBrokenProviderDoesNotFailTheJob() {
        start(config(), FakeProvider.failing("openai", ProviderErrorKind.NOT_CONFIGURED),
                FakeProvider.answering("perplexity"));
        String jobId = jobFor(TestData.org("a", SubscriptionTier.STARTER), 3);

        assertEquals(BatchDriver.Outcome.FINALIZED, deps.driverLauncher().runNow(jobId).outcome());

        BatchJob done = job(jobId);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(3, done.completedTasks());
        assertEquals(3, done.failedTasks());
    }

    @Test
    void standsDownWhileAnotherDriverIsAlive() {
        FakeProvider openai = FakeProvider.answering("openai");
        start(config(), openai);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 2);
        Instant now = clock.instant();
        assertEquals(LeaseResult.CLAIMED,
                deps.jobRepository().tryAcquireLease(jobId, "drv-other", now, now.minusSeconds(30)));

        clock.advance(Duration.ofSeconds(10));
        BatchDriver.Result result = deps.driverLauncher().runNow(jobId);

        assertEquals(BatchDriver.Outcome.NOT_CLAIMED, result.outcome());
        assertEquals(0, openai.callCount());
        assertEquals("drv-other", job(jobId).driverId());
    }

    @Test
    void ineligibleOrganizationFailsTheJob() {
        FakeProvider openai = FakeProvider.answering("openai");
        start(config(), openai);
        Organization expired = new Organization("a", "A", SubscriptionTier.FREE, false,
                clock.instant().minusSeconds(60), List.of());
        String jobId = jobFor(expired, 2);

        assertEquals(BatchDriver.Outcome.FAILED, deps.driverLauncher().runNow(jobId).outcome());
        assertEquals(0, openai.callCount());
        assertEquals(JobStatus.FAILED, job(jobId).status());
    }

    @Test
    void cancelledJobIsNotDriven() {
        FakeProvider openai = FakeProvider.answering("openai");
        start(config(), openai);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 2);
        deps.jobService().cancel(jobId);

        assertEquals(BatchDriver.Outcome.JOB_TERMINAL, deps.driverLauncher().runNow(jobId).outcome());
        assertEquals(0, openai.callCount());
    }

    @Test
    void ceilingHandsJobBackWithLeaseReleased() {
        FakeProvider openai = FakeProvider.answering("openai");
        start(config().withDriverCeiling(Duration.ZERO), openai);
        String jobId = jobFor(TestData.org("a", SubscriptionTier.FREE), 2);

        BatchDriver.Result result = deps.driverLauncher().runNow(jobId);

        assertEquals(BatchDriver.Outcome.CEILING_REACHED, result.outcome());
        BatchJob job = job(jobId);
        assertEquals(JobStatus.PROCESSING, job.status());
        assertFalse(job.driverActive());
    }
}
