package promptbatch.engine.scheduler;

import promptbatch.engine.config.Dependencies;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.model.Organization;
import promptbatch.engine.model.SchedulerRun;
import promptbatch.engine.model.SubscriptionTier;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.service.ResponseHandoff;
import promptbatch.engine.support.FakeProvider;
import promptbatch.engine.support.MutableClock;
import promptbatch.engine.support.TestData;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DailyTriggerTest {

    private static final String TODAY = "2026-10-19";

    private MutableClock clock;
    private Dependencies deps;
    private FakeProvider openai;

    @BeforeEach
    void setup() {
        clock = new MutableClock(TestData.IN_WINDOW);
        openai = FakeProvider.answering("openai");
        deps = Dependencies.create(TestData.config("test-trigger", clock),
                new ProviderRegistry().register(openai).register(FakeProvider.answering("perplexity")),
                ResponseHandoff.none());
    }

    @AfterEach
    void teardown() {
        deps.close();
    }

    private TriggerResult trigger(boolean force) throws Exception {
        TriggerResult result = deps.dailyTrigger().trigger(force, "test");
        deps.driverLauncher().awaitIdle(Duration.ofSeconds(20));
        return result;
    }

    private void seedOrgs() {
        TestData.seed(deps.promptCatalog(), TestData.org("a", SubscriptionTier.FREE), 2);
        TestData.seed(deps.promptCatalog(), TestData.org("b", SubscriptionTier.STARTER), 1);
        TestData.seed(deps.promptCatalog(),
                new Organization("c", "Lapsed", SubscriptionTier.PRO, false, null, List.of()), 3);
    }

    @Test
    void createsAndDrivesOneJobPerEligibleOrganization() throws Exception {
        seedOrgs();

        TriggerResult result = trigger(false);

        assertEquals(SchedulerRun.COMPLETED, result.status());
        assertEquals(TODAY, result.runKey());
        assertEquals(2, result.created());
        assertEquals(1, result.skipped(), "Org without subscription is skipped");
        List<BatchJob> jobs = deps.jobRepository().findByRunKey(TODAY);
        assertEquals(2, jobs.size());
        for (BatchJob job : jobs) {
            assertEquals(JobStatus.COMPLETED, job.status(), "Job " + job.id() + " should be drained");
            assertEquals(job.totalTasks(), job.completedTasks());
        }
        assertEquals(TODAY, deps.schedulerRunRepository().lastDailyRunKey().orElseThrow());
    }

    @Test
    void doesNothingOutsideExecutionWindow() throws Exception {
        seedOrgs();
        clock.set(TestData.OUT_OF_WINDOW);

        TriggerResult result = trigger(false);

        assertEquals(SchedulerRun.SKIPPED, result.status());
        assertTrue(result.reason().contains("window"));
        assertTrue(deps.jobRepository().findByRunKey(TODAY).isEmpty());
        assertEquals(SchedulerRun.SKIPPED, deps.jobService().recentRuns(5).get(0).status());
    }

    @Test
    void runsOncePerWindowUnlessForced() throws Exception {
        seedOrgs();
        trigger(false);
        int callsAfterFirst = openai.callCount();

        clock.advance(Duration.ofMinutes(15));
        TriggerResult again = trigger(false);
        assertEquals(SchedulerRun.SKIPPED, again.status());
        assertTrue(again.reason().startsWith("Already ran"));

        TriggerResult forced = trigger(true);
        assertEquals(SchedulerRun.COMPLETED, forced.status());
        assertTrue(forced.forced());
        assertEquals(0, forced.created(), "Force never duplicates a job");
        assertEquals(3, forced.skipped());
        assertEquals(2, deps.jobRepository().findByRunKey(TODAY).size());
        assertEquals(callsAfterFirst, openai.callCount());
    }

    @Test
    void forceRearmsOpenJobInsteadOfCreatingAnother() throws Exception {
        Organization org = TestData.org("a", SubscriptionTier.FREE);
        TestData.seed(deps.promptCatalog(), org, 2);
        BatchJob stuck = TestData.newJob("job-stuck", "a", TODAY, clock.instant());
        deps.jobRepository().insert(stuck);
        deps.matrixBuilder().build(stuck, org);
        clock.set(TestData.OUT_OF_WINDOW);

        TriggerResult result = trigger(true);

        assertEquals(0, result.created());
        assertEquals(1, result.rearmed());
        assertEquals("job-stuck", result.jobs().get(0).jobId());
        assertFalse(result.jobs().get(0).created());
        assertEquals(1, deps.jobRepository().findByRunKey(TODAY).size());
        assertEquals(JobStatus.COMPLETED, deps.jobRepository().findById("job-stuck").orElseThrow().status());
    }

    @Test
    void openJobFromEarlierWindowIsDrivenFirst() throws Exception {
        Organization org = TestData.org("a", SubscriptionTier.FREE);
        TestData.seed(deps.promptCatalog(), org, 1);
        BatchJob yesterday = TestData.newJob("job-yesterday", "a", "2026-10-18", clock.instant().minusSeconds(86_400));
        deps.jobRepository().insert(yesterday);

        TriggerResult result = trigger(false);

        assertEquals(1, result.rearmed());
        assertTrue(deps.jobRepository().findByRunKey(TODAY).isEmpty());
        BatchJob done = deps.jobRepository().findById("job-yesterday").orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1, done.totalTasks(), "Matrix is built on re-arm");
    }

    @Test
    void organizationWithoutPromptsGetsEmptyCompletedJob() throws Exception {
        deps.promptCatalog().saveOrganization(TestData.org("a", SubscriptionTier.PRO));

        TriggerResult result = trigger(false);

        assertEquals(1, result.created());
        assertEquals(0, result.jobs().get(0).totalTasks());
        BatchJob job = deps.jobRepository().findByRunKey(TODAY).get(0);
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(0, openai.callCount());
    }
}
