package com.acme.render.web;

import com.acme.render.core.CircuitOpenException;
import com.acme.render.core.InsufficientCreditsException;
import com.acme.render.core.NotFoundException;
import com.acme.render.core.ProviderRejectedException;
import com.acme.render.core.ProviderUnavailableException;
import com.acme.render.core.UnsupportedEngineException;
import com.acme.render.render.RenderService;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@MicronautTest(transactional = false)
class RenderControllerTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    RenderService renderService;

    @MockBean(RenderService.class)
    RenderService mockRenderService() {
        return mock(RenderService.class);
    }

    private HttpRequest<String> render(UUID variantId, int duration) {
        return HttpRequest.POST("/renders",
            "{\"variantId\":\"" + variantId + "\",\"engineClass\":\"veo_fast\",\"request\":{\"duration\":" + duration + "}}");
    }

    @Test
    void testAcceptedRender() {
        UUID variantId = UUID.randomUUID();
        UUID runId = UUID.randomUUID();
        when(renderService.submit(variantId, "veo_fast", "{\"duration\":8}")).thenReturn(runId);

        var response = client.toBlocking().exchange(render(variantId, 8), String.class);

        assertEquals(HttpStatus.ACCEPTED, response.getStatus());
        assertEquals(runId.toString(), response.getHeaders().get("X-Run-Id"));
        assertTrue(response.body().contains(runId.toString()));
    }

    @Test
    void testProviderUnavailableIsGeneric503() {
        UUID variantId = UUID.randomUUID();
        when(renderService.submit(any(), any(), any()))
            .thenThrow(new ProviderUnavailableException(UUID.randomUUID(), new RuntimeException("HTTP 503 quota project-42")));

        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(render(variantId, 8), String.class));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getStatus());
        String body = e.getResponse().getBody(String.class).orElse("");
        assertEquals("{\"error\":\"Video generation temporarily unavailable\"}", body);
    }

    @Test
    void testOpenCircuitIs503() {
        when(renderService.submit(any(), any(), any())).thenThrow(new CircuitOpenException("veo.generate", 1000));

        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(render(UUID.randomUUID(), 8), String.class));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, e.getStatus());
    }

    @Test
    void testInsufficientCreditsIs402() {
        when(renderService.submit(any(), any(), any()))
            .thenThrow(new InsufficientCreditsException(UUID.randomUUID(), 1, 0));

        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(render(UUID.randomUUID(), 24), String.class));

        assertEquals(HttpStatus.PAYMENT_REQUIRED, e.getStatus());
    }

    @Test
    void testUnknownVariantIs404() {
        UUID variantId = UUID.randomUUID();
        when(renderService.submit(any(), any(), any())).thenThrow(new NotFoundException("Variant", variantId));

        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(render(variantId, 8), String.class));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatus());
    }

    @Test
    void testMalformedBodyIs400() {
        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(HttpRequest.POST("/renders", "{\"variantId\":\"nope\"}"), String.class));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        verifyNoInteractions(renderService);
    }

    @Test
    void testUnmonitoredEngineIs400() {
        UUID variantId = UUID.randomUUID();
        when(renderService.submit(variantId, "veo_quality", "{\"duration\":24}"))
            .thenThrow(new UnsupportedEngineException("veo_quality"));

        var e = assertThrows(HttpClientResponseException.class, () -> client.toBlocking().exchange(
            HttpRequest.POST("/renders", "{\"variantId\":\"" + variantId
                + "\",\"engineClass\":\"veo_quality\",\"request\":{\"duration\":24}}"), String.class));

        assertEquals(HttpStatus.BAD_REQUEST, e.getStatus());
        assertTrue(e.getResponse().getBody(String.class).orElse("").contains("veo_quality"));
    }

    @Test
    void testProviderRejectionIs422NotRetryHint() {
        when(renderService.submit(any(), any(), any()))
            .thenThrow(new ProviderRejectedException(UUID.randomUUID(), new RuntimeException("HTTP 400 invalid prompt")));

        var e = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(render(UUID.randomUUID(), 8), String.class));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, e.getStatus());
        assertEquals("{\"error\":\"Video generation request was rejected\"}",
            e.getResponse().getBody(String.class).orElse(""));
    }
}
