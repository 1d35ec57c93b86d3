package promptbatch.engine.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import promptbatch.engine.api.Controller;
import promptbatch.engine.api.internal.v1.dto.TriggerRequest;
import promptbatch.engine.scheduler.DailyTrigger;
import promptbatch.engine.scheduler.ReconcileReport;
import promptbatch.engine.scheduler.Reconciler;
import promptbatch.engine.scheduler.TriggerResult;
import promptbatch.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Cron entry points (internal API).
 *
 * POST /internal/v1/trigger - Fire the daily trigger, body {"force": bool, "triggerSource": str}
 * POST /internal/v1/reconcile - Run one reconciler sweep
 */
public class TriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private final DailyTrigger trigger;
    private final Reconciler reconciler;

    public TriggerController(DailyTrigger trigger, Reconciler reconciler) {
        this.trigger = trigger;
        this.reconciler = reconciler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return "/internal/v1/trigger".equals(path) || "/internal/v1/reconcile".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if ("/internal/v1/trigger".equals(path)) {
                return handleTrigger(req);
            }
            ReconcileReport report = reconciler.reconcile("http");
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(report));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Trigger controller error on {}", path, e);
            return ControllerResponse.error(e.getMessage());
        }
    }

    private ControllerResponse handleTrigger(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TriggerRequest request;
        if (body.isBlank()) {
            request = TriggerRequest.empty();
        } else {
            try {
                request = RouterHandler.mapper().readValue(body, TriggerRequest.class);
            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                throw new IllegalArgumentException("malformed trigger request");
            }
            if (request == null) {
                // literal JSON null
                request = TriggerRequest.empty();
            }
        }

        TriggerResult result = trigger.trigger(request.force(), request.sourceOrDefault());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(result));
    }
}
