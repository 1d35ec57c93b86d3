package promptbatch.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import promptbatch.engine.api.Controller;
import promptbatch.engine.api.v1.dto.SchedulerRunResponse;
import promptbatch.engine.server.RouterHandler;
import promptbatch.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Audit trail of trigger and reconciler invocations.
 * GET /api/v1/scheduler/runs?limit=
 */
public class SchedulerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SchedulerController.class);

    private final JobService jobService;

    public SchedulerController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/scheduler/runs".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<String> limitParam = new QueryStringDecoder(req.uri()).parameters().get("limit");
            int limit = 0;
            if (limitParam != null && !limitParam.isEmpty()) {
                try {
                    limit = Integer.parseInt(limitParam.get(0));
                } catch (NumberFormatException e) {
                    return ControllerResponse.badRequest("limit must be a number");
                }
            }

            List<SchedulerRunResponse> runs = jobService.recentRuns(limit).stream()
                    .map(SchedulerRunResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("runs", runs, "count", runs.size())));
        } catch (Exception e) {
            log.error("Scheduler controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
