package promptbatch.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import promptbatch.engine.api.Controller;
import promptbatch.engine.api.internal.v1.dto.OperationResponse;
import promptbatch.engine.api.v1.dto.JobResponse;
import promptbatch.engine.api.v1.dto.TaskResponse;
import promptbatch.engine.model.BatchJob;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.JobStatus;
import promptbatch.engine.server.RouterHandler;
import promptbatch.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Job monitoring and cancellation (public API).
 *
 * GET /api/v1/jobs?orgId=&status=&limit= - List jobs, newest first
 * GET /api/v1/jobs/{jobId} - Get job progress
 * GET /api/v1/jobs/{jobId}/tasks - Get the job's tasks
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_TASKS_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/tasks$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOB_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() ||
                    JOB_BY_ID_PATTERN.matcher(path).matches() ||
                    JOB_TASKS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher cancelMatcher = JOB_CANCEL_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            if (JOBS_PATTERN.matcher(path).matches()) {
                return handleList(new QueryStringDecoder(req.uri()).parameters());
            }

            Matcher tasksMatcher = JOB_TASKS_PATTERN.matcher(path);
            if (tasksMatcher.matches()) {
                return handleGetTasks(tasksMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleList(Map<String, List<String>> params) throws Exception {
        String orgId = param(params, "orgId");
        String statusParam = param(params, "status");
        JobStatus status = null;
        if (statusParam != null) {
            try {
                status = JobStatus.valueOf(statusParam.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown status: " + statusParam);
            }
        }
        String limitParam = param(params, "limit");
        int limit;
        try {
            limit = limitParam != null ? Integer.parseInt(limitParam) : 0;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }

        List<JobResponse> jobs = jobService.listJobs(orgId, status, limit).stream()
                .map(JobResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("jobs", jobs, "count", jobs.size())));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<BatchJob> job = jobService.getJob(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found: " + jobId);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
    }

    /**
     * GET /api/v1/jobs/{jobId}/tasks
     */
    private ControllerResponse handleGetTasks(String jobId) throws Exception {
        if (jobService.getJob(jobId).isEmpty()) {
            return ControllerResponse.notFound("job not found: " + jobId);
        }
        List<BatchTask> tasks = jobService.getTasks(jobId);
        List<TaskResponse> body = tasks.stream().map(TaskResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("jobId", jobId, "tasks", body, "count", body.size())));
    }

    /**
     * POST /api/v1/jobs/{jobId}/cancel
     */
    private ControllerResponse handleCancel(String jobId) throws Exception {
        JobService.CancelResult result = jobService.cancel(jobId);
        return switch (result) {
            case NOT_FOUND -> ControllerResponse.notFound("job not found: " + jobId);
            case ALREADY_TERMINAL -> ControllerResponse.conflict("job already finished: " + jobId);
            case CANCELLED -> ControllerResponse.json(RouterHandler.mapper()
                    .writeValueAsString(OperationResponse.of(true, jobId, result)));
        };
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
