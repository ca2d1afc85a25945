package com.acme.render.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Pricing and provider wiring for render submissions.
 */
@ConfigurationProperties("render")
public class RenderConfig {

    private int finalCost = 1;
    private String providerOperation = "veo.generate";
    private String defaultEngine = "veo_fast";

    public int getFinalCost() {
        return finalCost;
    }

    public void setFinalCost(int finalCost) {
        this.finalCost = finalCost;
    }

    public String getProviderOperation() {
        return providerOperation;
    }

    public void setProviderOperation(String providerOperation) {
        this.providerOperation = providerOperation;
    }

    public String getDefaultEngine() {
        return defaultEngine;
    }

    public void setDefaultEngine(String defaultEngine) {
        this.defaultEngine = defaultEngine;
    }
}
