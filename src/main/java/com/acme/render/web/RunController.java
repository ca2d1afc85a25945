package com.acme.render.web;

import com.acme.render.core.CircuitOpenException;
import com.acme.render.core.InsufficientCreditsException;
import com.acme.render.core.Jsons;
import com.acme.render.core.NotFoundException;
import com.acme.render.core.ProviderRejectedException;
import com.acme.render.core.ProviderUnavailableException;
import com.acme.render.core.UnsupportedEngineException;
import com.acme.render.monitor.RunTimeoutStatus;
import com.acme.render.monitor.TimeoutMonitor;
import com.acme.render.render.RenderService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;
import java.util.UUID;

@Controller("/runs")
@ExecuteOn(TaskExecutors.BLOCKING)
public class RunController {
    private final TimeoutMonitor monitor;
    private final RenderService renders;

    public RunController(TimeoutMonitor monitor, RenderService renders) {
        this.monitor = monitor;
        this.renders = renders;
    }

    @Get("/{id}/timeout")
    public HttpResponse<?> timeout(@PathVariable UUID id) {
        RunTimeoutStatus status = monitor.checkRunTimeout(id);
        return HttpResponse.ok(Jsons.toJson(Map.of(
            "isTimedOut", status.isTimedOut(),
            "runningTimeMs", status.runningTimeMs(),
            "timeoutThresholdMs", status.timeoutThresholdMs()
        )));
    }

    @Post("/{id}/resubmit")
    public HttpResponse<?> resubmit(@PathVariable UUID id) {
        try {
            UUID runId = renders.resubmit(id);
            return HttpResponse.accepted().body(Jsons.toJson(Map.of("runId", runId.toString(), "retryOf", id.toString())));
        } catch (NotFoundException e) {
            return HttpResponse.notFound(Jsons.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return HttpResponse.status(HttpStatus.CONFLICT).body(Jsons.of("error", e.getMessage()));
        } catch (UnsupportedEngineException e) {
            return HttpResponse.badRequest(Jsons.of("error", e.getMessage()));
        } catch (InsufficientCreditsException e) {
            return HttpResponse.status(HttpStatus.PAYMENT_REQUIRED).body(Jsons.of("error", e.getMessage()));
        } catch (ProviderRejectedException e) {
            return HttpResponse.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Jsons.of("error", RenderController.REJECTED));
        } catch (ProviderUnavailableException | CircuitOpenException e) {
            return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Jsons.of("error", RenderController.UNAVAILABLE));
        }
    }
}
