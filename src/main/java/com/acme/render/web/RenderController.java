package com.acme.render.web;

import com.acme.render.core.CircuitOpenException;
import com.acme.render.core.InsufficientCreditsException;
import com.acme.render.core.Jsons;
import com.acme.render.core.NotFoundException;
import com.acme.render.core.ProviderRejectedException;
import com.acme.render.core.ProviderUnavailableException;
import com.acme.render.core.UnsupportedEngineException;
import com.acme.render.render.RenderService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Controller("/renders")
@ExecuteOn(TaskExecutors.BLOCKING)
public class RenderController {
    private static final Logger LOG = LoggerFactory.getLogger(RenderController.class);

    static final String UNAVAILABLE = "Video generation temporarily unavailable";
    static final String REJECTED = "Video generation request was rejected";

    private final RenderService renders;

    public RenderController(RenderService renders) {
        this.renders = renders;
    }

    @Post
    public HttpResponse<?> submit(@Body String payload) {
        UUID variantId;
        String engineClass;
        String request;
        try {
            Map<String, Object> body = Jsons.toMap(payload);
            variantId = UUID.fromString(String.valueOf(body.get("variantId")));
            engineClass = body.get("engineClass") != null ? body.get("engineClass").toString() : null;
            request = Jsons.toJson(body.getOrDefault("request", Map.of()));
        } catch (RuntimeException e) {
            return HttpResponse.badRequest(Jsons.of("error", "Invalid render request"));
        }

        try {
            UUID runId = renders.submit(variantId, engineClass, request);
            return HttpResponse.accepted()
                .header("X-Run-Id", runId.toString())
                .body(Jsons.toJson(Map.of("runId", runId.toString(), "state", "running")));
        } catch (InsufficientCreditsException e) {
            return HttpResponse.status(HttpStatus.PAYMENT_REQUIRED)
                .body(Jsons.toJson(Map.of("error", e.getMessage(), "required", e.getRequired(),
                    "available", e.getAvailable())));
        } catch (UnsupportedEngineException e) {
            return HttpResponse.badRequest(Jsons.of("error", e.getMessage()));
        } catch (ProviderRejectedException e) {
            LOG.warn("Render of variant {} refused by provider: {}", variantId, e.getCause().getMessage());
            return HttpResponse.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Jsons.of("error", REJECTED));
        } catch (ProviderUnavailableException | CircuitOpenException e) {
            LOG.warn("Render of variant {} rejected: {}", variantId, e.getMessage());
            return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE).body(Jsons.of("error", UNAVAILABLE));
        } catch (NotFoundException e) {
            return HttpResponse.notFound(Jsons.of("error", e.getMessage()));
        }
    }
}
