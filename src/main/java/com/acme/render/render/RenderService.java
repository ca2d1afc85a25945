package com.acme.render.render;

import com.acme.render.config.RenderConfig;
import com.acme.render.config.TimeoutConfig;
import com.acme.render.core.CircuitBreakerRegistry;
import com.acme.render.core.ErrorCategory;
import com.acme.render.core.ErrorClassification;
import com.acme.render.core.ErrorClassifier;
import com.acme.render.core.InsufficientCreditsException;
import com.acme.render.core.Jsons;
import com.acme.render.core.NotFoundException;
import com.acme.render.core.ProviderRejectedException;
import com.acme.render.core.ProviderUnavailableException;
import com.acme.render.core.ResilientCallExecutor;
import com.acme.render.core.UnsupportedEngineException;
import com.acme.render.monitor.RunClassifier;
import com.acme.render.spi.CreditLedger;
import com.acme.render.spi.GenerationProvider;
import com.acme.render.spi.JobStore;
import com.acme.render.spi.JobStore.ProjectRow;
import com.acme.render.spi.JobStore.RunRow;
import com.acme.render.spi.RunState;
import com.acme.render.spi.VariantStatus;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates render runs and hands them to the generation provider. The provider call goes
 * through the circuit breaker first and the retry executor inside it, so an exhausted
 * retry sequence counts as one breaker failure.
 *
 * <p>Final renders are debited before the provider is called, so every path that fails a
 * final run (provider rejection, failure callback, timeout) has a usage entry to refund.
 */
@Singleton
public class RenderService {
    private static final Logger LOG = LoggerFactory.getLogger(RenderService.class);

    private final JobStore jobs;
    private final CreditLedger ledger;
    private final GenerationProvider provider;
    private final ResilientCallExecutor retry;
    private final CircuitBreakerRegistry breakers;
    private final ErrorClassifier classifier;
    private final RunClassifier runClassifier;
    private final RunCompletionService completions;
    private final RenderConfig config;
    private final TimeoutConfig timeoutConfig;

    public RenderService(
        JobStore jobs,
        CreditLedger ledger,
        GenerationProvider provider,
        ResilientCallExecutor retry,
        CircuitBreakerRegistry breakers,
        ErrorClassifier classifier,
        RunClassifier runClassifier,
        RunCompletionService completions,
        RenderConfig config,
        TimeoutConfig timeoutConfig
    ) {
        this.jobs = jobs;
        this.ledger = ledger;
        this.provider = provider;
        this.retry = retry;
        this.breakers = breakers;
        this.classifier = classifier;
        this.runClassifier = runClassifier;
        this.completions = completions;
        this.config = config;
        this.timeoutConfig = timeoutConfig;
    }

    /**
     * Starts a new render of {@code variantId}. Final renders are debited when the run is
     * created and refunded if the provider does not take the job.
     *
     * @return the id of the created run
     * @throws NotFoundException            if the variant or its project does not exist
     * @throws UnsupportedEngineException   if the engine is not one the timeout monitor watches
     * @throws InsufficientCreditsException if a final render is requested without credits
     * @throws ProviderRejectedException    if the provider refused the request; the run is failed
     * @throws ProviderUnavailableException if the provider could not take the job; the run is failed
     */
    public UUID submit(UUID variantId, String engineClass, String requestJson) {
        return start(variantId, engineClass, requestJson, null);
    }

    /**
     * Re-runs a run that the timeout monitor failed with the retry action. A run is
     * resubmitted at most once.
     *
     * @throws IllegalStateException if the run is not waiting for resubmission
     */
    public UUID resubmit(UUID runId) {
        RunRow run = jobs.findRun(runId).orElseThrow(() -> new NotFoundException("Run", runId));
        Object action = Jsons.toMap(run.responseJson()).get("timeout_action");
        if (run.state() != RunState.FAILED || !"retry".equals(action)) {
            throw new IllegalStateException("Run " + runId + " is not awaiting resubmission");
        }
        if (jobs.countRetries(runId) > 0) {
            throw new IllegalStateException("Run " + runId + " has already been resubmitted");
        }
        LOG.info("Resubmitting timed out run {}", runId);
        // a concurrent resubmit that passed the check above loses on createRun
        return start(run.variantId(), run.engineClass(), run.requestJson(), runId);
    }

    private UUID start(UUID variantId, String engineClass, String requestJson, UUID retryOf) {
        var variant = jobs.findVariant(variantId).orElseThrow(() -> new NotFoundException("Variant", variantId));
        ProjectRow project = jobs.findProject(variant.projectId())
            .orElseThrow(() -> new NotFoundException("Project", variant.projectId()));
        String engine = engineClass != null && !engineClass.isBlank() ? engineClass : config.getDefaultEngine();
        if (!timeoutConfig.getMonitoredEngines().contains(engine)) {
            throw new UnsupportedEngineException(engine);
        }
        boolean isFinal = runClassifier.isFinal(requestJson);
        int cost = config.getFinalCost();

        if (isFinal) {
            long available = ledger.balance(project.userId());
            if (available < cost) {
                throw new InsufficientCreditsException(project.userId(), cost, available);
            }
        }

        UUID runId = jobs.createRun(variantId, engine, requestJson, retryOf);
        if (isFinal) {
            debit(project, variantId, runId, cost);
        }
        jobs.markRunning(runId);
        jobs.updateVariant(variantId, VariantStatus.RENDERING);

        String operation = config.getProviderOperation();
        String providerJobId;
        try {
            providerJobId = breakers.executeWithCircuitBreaker(
                () -> retry.executeWithRetry(() -> provider.submit(runId, engine, requestJson), operation),
                operation);
        } catch (Exception e) {
            ErrorClassification c = classifier.categorizeError(e);
            LOG.error("Provider rejected run {} ({}, retryable={}): {}", runId, c.category().value(),
                c.isRetryable(), e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error_category", c.category().value());
            details.put("recommended_action", c.recommendedAction());
            completions.complete(runId, false, details, String.valueOf(e.getMessage()));
            if (c.category() == ErrorCategory.CLIENT) {
                throw new ProviderRejectedException(runId, e);
            }
            throw new ProviderUnavailableException(runId, e);
        }

        jobs.updateRunResponse(runId, Jsons.merge(null, Map.of("provider_job_id", providerJobId)));
        LOG.info("Run {} accepted by provider as {}", runId, providerJobId);
        return runId;
    }

    private void debit(ProjectRow project, UUID variantId, UUID runId, int cost) {
        boolean charged;
        try {
            charged = ledger.debit(project.userId(), cost, "Final render", project.id(), variantId, runId).isPresent();
        } catch (RuntimeException e) {
            failUncharged(runId, "Credit debit failed");
            throw e;
        }
        if (!charged) {
            // another render spent the credits between the balance check and the debit
            failUncharged(runId, "Insufficient credits");
            throw new InsufficientCreditsException(project.userId(), cost, ledger.balance(project.userId()));
        }
    }

    private void failUncharged(UUID runId, String error) {
        jobs.transitionRun(runId, RunState.ACTIVE, RunState.FAILED, Jsons.merge(null, Map.of("error", error)), error);
    }
}
