package com.acme.render.render;

import com.acme.render.config.RenderConfig;
import com.acme.render.core.Jsons;
import com.acme.render.core.NotFoundException;
import com.acme.render.ledger.RefundService;
import com.acme.render.monitor.RunClassifier;
import com.acme.render.spi.JobStore;
import com.acme.render.spi.JobStore.RunRow;
import com.acme.render.spi.RunState;
import com.acme.render.spi.VariantStatus;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies provider completion callbacks. A result for a run that is no longer queued or
 * running (for instance one the timeout monitor already failed) is discarded.
 */
@Singleton
public class RunCompletionService {
    private static final Logger LOG = LoggerFactory.getLogger(RunCompletionService.class);

    private final JobStore jobs;
    private final RefundService refunds;
    private final RunClassifier runClassifier;
    private final RenderConfig config;

    public RunCompletionService(JobStore jobs, RefundService refunds,
                                RunClassifier runClassifier, RenderConfig config) {
        this.jobs = jobs;
        this.refunds = refunds;
        this.runClassifier = runClassifier;
        this.config = config;
    }

    /**
     * @return false if the result was stale and nothing changed
     */
    @Transactional
    public boolean complete(UUID runId, boolean succeeded, Map<String, ?> result, String error) {
        RunRow run = jobs.findRun(runId).orElseThrow(() -> new NotFoundException("Run", runId));

        Map<String, Object> patch = new LinkedHashMap<>();
        if (result != null) {
            patch.putAll(result);
        }
        if (!succeeded) {
            patch.put("error", error != null ? error : "Generation failed");
        }
        String response = Jsons.merge(run.responseJson(), patch);
        RunState target = succeeded ? RunState.SUCCEEDED : RunState.FAILED;

        if (!jobs.transitionRun(runId, RunState.ACTIVE, target, response, succeeded ? null : (String) patch.get("error"))) {
            LOG.warn("Discarding stale {} result for run {} in state {}", target.value(), runId, run.state().value());
            return false;
        }

        if (succeeded) {
            jobs.updateVariant(run.variantId(), VariantStatus.COMPLETED);
            LOG.info("Run {} completed", runId);
            return true;
        }

        jobs.updateVariant(run.variantId(), VariantStatus.ERROR);
        LOG.warn("Run {} failed at provider: {}", runId, patch.get("error"));
        if (runClassifier.isFinal(run.requestJson())) {
            refunds.attribute(run.variantId()).ifPresent(to ->
                refunds.refund(to, runId, config.getFinalCost(), "Provider reported failure"));
        }
        return true;
    }
}
