package com.acme.render.provider;

import com.acme.render.config.ProviderConfig;
import com.acme.render.core.Jsons;
import com.acme.render.spi.GenerationProvider;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts generation jobs to the provider's REST endpoint. Failures surface as exceptions whose
 * message carries the HTTP status so the retry executor and error classifier can read it.
 */
@Singleton
@Requires(notEnv = Environment.TEST)
public class HttpGenerationProvider implements GenerationProvider {
    private static final Logger LOG = LoggerFactory.getLogger(HttpGenerationProvider.class);

    private final ProviderConfig config;
    private final HttpClient http;

    public HttpGenerationProvider(ProviderConfig config) {
        this.config = config;
        this.http = HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .build();
    }

    @Override
    public String submit(UUID runId, String engineClass, String requestJson) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId.toString());
        body.put("engineClass", engineClass);
        body.put("request", Jsons.toMap(requestJson));
        body.put("callbackUrl", config.getCallbackUrl());

        HttpRequest request = HttpRequest.newBuilder(URI.create(config.getBaseUrl() + "/generate"))
            .timeout(config.getRequestTimeout())
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + config.getApiKey())
            .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(body)))
            .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RuntimeException("Network error calling provider: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted calling provider", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RuntimeException("HTTP " + status + " from provider: " + response.body());
        }
        Object jobId = Jsons.toMap(response.body()).get("jobId");
        if (jobId == null) {
            throw new RuntimeException("Provider response without jobId: " + response.body());
        }
        LOG.debug("Provider accepted run {} as job {}", runId, jobId);
        return jobId.toString();
    }
}
