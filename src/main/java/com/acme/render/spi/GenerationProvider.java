package com.acme.render.spi;

import java.util.UUID;

/**
 * The external video generation service. Completion is reported later through the
 * provider webhook.
 */
public interface GenerationProvider {

    /**
     * @return the provider's job id
     */
    String submit(UUID runId, String engineClass, String requestJson);
}
