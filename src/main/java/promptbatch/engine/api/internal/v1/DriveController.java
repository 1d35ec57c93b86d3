package promptbatch.engine.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import promptbatch.engine.api.Controller;
import promptbatch.engine.api.internal.v1.dto.OperationResponse;
import promptbatch.engine.server.RouterHandler;
import promptbatch.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Manual re-drive of one job (internal API).
 * POST /internal/v1/jobs/{jobId}/drive
 */
public class DriveController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DriveController.class);

    private static final Pattern DRIVE_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/drive$");

    private final JobService jobService;

    public DriveController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && DRIVE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = DRIVE_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown endpoint");
        }
        String jobId = m.group(1);
        try {
            JobService.DriveResult result = jobService.drive(jobId);
            String body = RouterHandler.mapper().writeValueAsString(
                    OperationResponse.of(result == JobService.DriveResult.LAUNCHED
                            || result == JobService.DriveResult.ALREADY_RUNNING, jobId, result));
            return switch (result) {
                case NOT_FOUND -> ControllerResponse.notFound("job not found: " + jobId);
                case JOB_TERMINAL -> ControllerResponse.json(HttpResponseStatus.CONFLICT, body);
                case LAUNCHED -> ControllerResponse.json(HttpResponseStatus.ACCEPTED, body);
                case ALREADY_RUNNING -> ControllerResponse.json(body);
            };
        } catch (Exception e) {
            log.error("Drive failed for job {}", jobId, e);
            return ControllerResponse.error("internal error");
        }
    }
}
