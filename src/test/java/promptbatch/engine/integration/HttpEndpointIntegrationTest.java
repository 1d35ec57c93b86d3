package promptbatch.engine.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import promptbatch.engine.config.Dependencies;
import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.SubscriptionTier;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.service.ResponseHandoff;
import promptbatch.engine.support.FakeProvider;
import promptbatch.engine.support.MutableClock;
import promptbatch.engine.support.TestData;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Trigger, monitor and cancel through the Netty server with fake providers behind it.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final int TEST_PORT = 18080;
        private static final String SECRET = "test-cron-secret";
        private static final String BASE_URL = "http://localhost:" + TEST_PORT;

        private Dependencies deps;
        private HttpClient httpClient;

        @BeforeEach
        void setUp() throws Exception {
                MutableClock clock = new MutableClock(TestData.IN_WINDOW);
                EngineConfig config = TestData.config("test-http", clock)
                                .withServerPort(TEST_PORT)
                                .withCronSecret(SECRET);
                deps = Dependencies.create(config,
                                new ProviderRegistry()
                                                .register(FakeProvider.answering("openai"))
                                                .register(FakeProvider.answering("perplexity")),
                                ResponseHandoff.none());

                TestData.seed(deps.promptCatalog(), TestData.org("acme", SubscriptionTier.STARTER), 3);

                deps.httpServer().start();

                // Wait for server to be ready
                TimeUnit.MILLISECONDS.sleep(200);

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                deps.close();
        }

        @Test
        @DisplayName("Health endpoint reports database and driver state")
        void healthIsReported() throws Exception {
                HttpResponse<String> response = get("/api/v1/health");

                assertEquals(200, response.statusCode());
                JsonNode body = MAPPER.readTree(response.body());
                assertEquals("healthy", body.get("status").asText());
                assertEquals("ok", body.get("database").asText());
                assertEquals(0, body.get("openJobs").asInt());
        }

        @Test
        @DisplayName("Internal endpoints reject requests without the cron secret")
        void internalEndpointsRequireSecret() throws Exception {
                assertEquals(401, post("/internal/v1/trigger", "{}", null).statusCode());
                assertEquals(401, post("/internal/v1/trigger", "{}", "wrong").statusCode());
                assertEquals(401, post("/internal/v1/reconcile", "", null).statusCode());
                assertTrue(deps.jobRepository().findByRunKey("2026-10-19").isEmpty());
        }

        @Test
        @DisplayName("Full HTTP flow: trigger, drain, inspect job and tasks, cancel is refused once finished")
        void triggerAndMonitorViaHttp() throws Exception {
                HttpResponse<String> triggerResponse = post("/internal/v1/trigger",
                                "{\"force\": false, \"triggerSource\": \"integration\"}", SECRET);

                assertEquals(200, triggerResponse.statusCode(), "Body: " + triggerResponse.body());
                JsonNode trigger = MAPPER.readTree(triggerResponse.body());
                assertEquals("COMPLETED", trigger.get("status").asText());
                assertEquals("2026-10-19", trigger.get("runKey").asText());
                assertEquals(1, trigger.get("created").asInt());
                String jobId = trigger.get("jobs").get(0).get("jobId").asText();
                assertEquals(6, trigger.get("jobs").get(0).get("totalTasks").asInt());

                deps.driverLauncher().awaitIdle(Duration.ofSeconds(20));

                HttpResponse<String> jobResponse = get("/api/v1/jobs/" + jobId);
                assertEquals(200, jobResponse.statusCode());
                JsonNode job = MAPPER.readTree(jobResponse.body());
                assertEquals("COMPLETED", job.get("status").asText());
                assertEquals("6/6", job.get("completed").asText());
                assertEquals("0/6", job.get("failed").asText());
                assertEquals(100, job.get("progressPercent").asInt());
                assertEquals("integration", job.get("triggerSource").asText());

                HttpResponse<String> tasksResponse = get("/api/v1/jobs/" + jobId + "/tasks");
                assertEquals(200, tasksResponse.statusCode());
                JsonNode tasks = MAPPER.readTree(tasksResponse.body());
                assertEquals(6, tasks.get("count").asInt());
                for (JsonNode task : tasks.get("tasks")) {
                        assertEquals("COMPLETED", task.get("status").asText());
                }

                HttpResponse<String> listResponse = get("/api/v1/jobs?orgId=acme&status=completed");
                assertEquals(1, MAPPER.readTree(listResponse.body()).get("count").asInt());

                assertEquals(409, post("/api/v1/jobs/" + jobId + "/cancel", "", null).statusCode());

                HttpResponse<String> again = post("/internal/v1/trigger", "", SECRET);
                assertEquals("SKIPPED", MAPPER.readTree(again.body()).get("status").asText());

                JsonNode runs = MAPPER.readTree(get("/api/v1/scheduler/runs?limit=10").body());
                assertEquals(2, runs.get("count").asInt());
                assertEquals("daily-batch-trigger", runs.get("runs").get(0).get("function").asText());
        }

        @Test
        @DisplayName("A JSON null trigger body is treated like an empty one")
        void nullTriggerBodyUsesDefaults() throws Exception {
                HttpResponse<String> response = post("/internal/v1/trigger", "null", SECRET);

                assertEquals(200, response.statusCode(), "Body: " + response.body());
                JsonNode trigger = MAPPER.readTree(response.body());
                assertEquals("COMPLETED", trigger.get("status").asText());
                assertFalse(trigger.get("forced").asBoolean());

                deps.driverLauncher().awaitIdle(Duration.ofSeconds(20));
                String jobId = trigger.get("jobs").get(0).get("jobId").asText();
                assertEquals("http", deps.jobRepository().findById(jobId).orElseThrow().triggerSource());
        }

        @Test
        @DisplayName("Reconcile endpoint returns an empty report when nothing is stale")
        void reconcileViaHttp() throws Exception {
                HttpResponse<String> response = post("/internal/v1/reconcile", "", SECRET);

                assertEquals(200, response.statusCode());
                JsonNode report = MAPPER.readTree(response.body());
                assertEquals(0, report.get("scanned").asInt());
                assertEquals(0, report.get("resumed").size());
        }

        @Test
        @DisplayName("Bad requests and unknown routes map to 400 and 404")
        void errorStatuses() throws Exception {
                assertEquals(404, get("/api/v1/nope").statusCode());
                assertEquals(404, get("/api/v1/jobs/missing").statusCode());
                assertEquals(404, post("/api/v1/jobs/missing/cancel", "", null).statusCode());
                assertEquals(404, post("/internal/v1/jobs/missing/drive", "", SECRET).statusCode());
                assertEquals(400, get("/api/v1/jobs?status=SLEEPING").statusCode());
                assertEquals(400, get("/api/v1/jobs?limit=lots").statusCode());
                assertEquals(400, post("/internal/v1/trigger", "{not json", SECRET).statusCode());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(BASE_URL + path))
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body, String secret) throws Exception {
                HttpRequest.Builder request = HttpRequest.newBuilder()
                                .uri(URI.create(BASE_URL + path))
                                .header("Content-Type", "application/json")
                                .POST(HttpRequest.BodyPublishers.ofString(body));
                if (secret != null) {
                        request.header("X-Cron-Secret", secret);
                }
                return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        }
}
