package com.acme.render.web;

import com.acme.render.core.Jsons;
import com.acme.render.core.NotFoundException;
import com.acme.render.render.RunCompletionService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Completion callbacks from the generation provider.
 */
@Controller("/webhooks/provider")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ProviderWebhookController {
    private final RunCompletionService completions;

    public ProviderWebhookController(RunCompletionService completions) {
        this.completions = completions;
    }

    @Post
    public HttpResponse<?> callback(@Body String payload) {
        UUID runId;
        String status;
        Map<String, Object> body;
        try {
            body = Jsons.toMap(payload);
            runId = UUID.fromString(String.valueOf(body.get("runId")));
            status = String.valueOf(body.get("status"));
        } catch (RuntimeException e) {
            return HttpResponse.badRequest(Jsons.of("error", "Invalid callback"));
        }
        boolean succeeded = "succeeded".equalsIgnoreCase(status) || "completed".equalsIgnoreCase(status);

        Map<String, Object> result = new LinkedHashMap<>();
        if (body.get("videoUrl") != null) {
            result.put("video_url", body.get("videoUrl"));
        }
        String error = body.get("error") != null ? body.get("error").toString() : null;

        try {
            boolean applied = completions.complete(runId, succeeded, result, error);
            return HttpResponse.ok(Jsons.toJson(Map.of("runId", runId.toString(), "applied", applied)));
        } catch (NotFoundException e) {
            return HttpResponse.notFound(Jsons.of("error", e.getMessage()));
        }
    }
}
