package promptbatch.engine.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Fires the daily trigger over HTTP and follows the dispatched jobs until each one has
 * every task completed or failed.
 * Exit code 0 only when all of them got there before the timeout.
 */
@Command(name = "check", description = "Trigger the daily batch and monitor it to completion")
final class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"--url"}, description = "Engine base URL", defaultValue = "${env:PROMPTBATCH_URL:-http://localhost:8080}")
    String url;

    @Option(names = {"--secret"}, description = "Cron secret (X-Cron-Secret)", defaultValue = "${env:PROMPTBATCH_CRON_SECRET}")
    String secret;

    @Option(names = {"--force"}, description = "Bypass the execution window and once-per-window guards")
    boolean force;

    @Option(names = {"--no-monitor"}, description = "Fire the trigger and exit")
    boolean noMonitor;

    @Option(names = {"--timeout"}, description = "Monitoring timeout in minutes", defaultValue = "60")
    long timeoutMinutes;

    @Option(names = {"--poll"}, description = "Polling interval in seconds", defaultValue = "10")
    long pollSeconds;

    @Option(names = {"--verbose", "-v"}, description = "Print each poll")
    boolean verbose;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        BatchApiClient client = new BatchApiClient(url, secret);

        JsonNode result;
        try {
            result = client.trigger(force, "cli");
        } catch (IOException e) {
            out.println("Trigger failed: " + e.getMessage());
            out.flush();
            return 1;
        }

        String status = result.path("status").asText();
        out.printf("Trigger %s for %s: %s%n", result.path("runId").asText(), result.path("runKey").asText(), status);
        if ("SKIPPED".equals(status)) {
            out.println("Skipped: " + result.path("reason").asText());
            out.flush();
            return 1;
        }

        Map<String, String> orgByJob = new LinkedHashMap<>();
        for (JsonNode job : result.path("jobs")) {
            String jobId = job.path("jobId").asText();
            orgByJob.put(jobId, job.path("orgName").asText(job.path("orgId").asText()));
            out.printf("  %s %s (%d tasks)%n", job.path("created").asBoolean() ? "created " : "re-armed", jobId,
                    job.path("totalTasks").asInt());
        }
        out.flush();

        if (noMonitor) {
            return 0;
        }
        return monitor(client, orgByJob, out);
    }

    private int monitor(BatchApiClient client, Map<String, String> orgByJob, PrintWriter out)
            throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofMinutes(timeoutMinutes).toNanos();
        Map<String, JsonNode> latest = new LinkedHashMap<>();
        List<String> open = new ArrayList<>(orgByJob.keySet());

        while (!open.isEmpty()) {
            for (String jobId : new ArrayList<>(open)) {
                try {
                    JsonNode job = client.job(jobId);
                    latest.put(jobId, job);
                    if (verbose) {
                        out.printf("  %s %s %s completed, %s failed%n", jobId, job.path("status").asText(),
                                job.path("completed").asText(), job.path("failed").asText());
                    }
                    if (isFullyProcessed(job) || isTerminal(job)) {
                        open.remove(jobId);
                    }
                } catch (IOException e) {
                    out.println("  poll failed for " + jobId + ": " + e.getMessage());
                }
            }
            out.flush();
            if (open.isEmpty() || System.nanoTime() >= deadline) {
                break;
            }
            Thread.sleep(Duration.ofSeconds(pollSeconds).toMillis());
        }

        List<String> incomplete = new ArrayList<>();
        for (Map.Entry<String, String> e : orgByJob.entrySet()) {
            JsonNode job = latest.get(e.getKey());
            if (job == null || !isFullyProcessed(job)) {
                incomplete.add(e.getValue() + " (" + e.getKey() + (job != null ? ", " + job.path("completed").asText()
                        + " completed, " + job.path("status").asText() : "") + ")");
            }
        }

        if (incomplete.isEmpty()) {
            out.printf("All %d jobs fully processed%n", orgByJob.size());
            out.flush();
            return 0;
        }
        out.printf("%d of %d jobs incomplete:%n", incomplete.size(), orgByJob.size());
        for (String line : incomplete) {
            out.println("  " + line);
        }
        out.flush();
        return 1;
    }

    static boolean isFullyProcessed(JsonNode job) {
        int total = job.path("totalTasks").asInt();
        return job.path("completedTasks").asInt() + job.path("failedTasks").asInt() == total;
    }

    private static boolean isTerminal(JsonNode job) {
        String status = job.path("status").asText();
        return "COMPLETED".equals(status) || "FAILED".equals(status) || "CANCELLED".equals(status);
    }
}
