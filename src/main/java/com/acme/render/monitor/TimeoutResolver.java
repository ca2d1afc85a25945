package com.acme.render.monitor;

import com.acme.render.config.TimeoutConfig;
import com.acme.render.core.FastPathPublisher;
import com.acme.render.core.Jsons;
import com.acme.render.core.Outbox;
import com.acme.render.ledger.RefundService;
import com.acme.render.ledger.RefundService.Attribution;
import com.acme.render.monitor.TimeoutAction.Kind;
import com.acme.render.spi.JobStore;
import com.acme.render.spi.JobStore.RunRow;
import com.acme.render.spi.OutboxStore;
import com.acme.render.spi.RunState;
import com.acme.render.spi.VariantStatus;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the timeout decision for one run. The run transition, the refund and the outbox
 * event commit together; whoever moves the run out of queued/running first owns the side
 * effects, everyone else does nothing.
 */
@Singleton
public class TimeoutResolver {
    private static final Logger LOG = LoggerFactory.getLogger(TimeoutResolver.class);

    static final String TIMED_OUT = "Generation timed out";

    private final JobStore jobs;
    private final RefundService refunds;
    private final RunClassifier classifier;
    private final OutboxStore outboxStore;
    private final Outbox outbox;
    private final FastPathPublisher fastPath;
    private final TimeoutConfig config;

    public TimeoutResolver(
        JobStore jobs,
        RefundService refunds,
        RunClassifier classifier,
        OutboxStore outboxStore,
        Outbox outbox,
        FastPathPublisher fastPath,
        TimeoutConfig config
    ) {
        this.jobs = jobs;
        this.refunds = refunds;
        this.classifier = classifier;
        this.outboxStore = outboxStore;
        this.outbox = outbox;
        this.fastPath = fastPath;
        this.config = config;
    }

    /**
     * Previews get one retry, finals get their credits back, exhausted retries are just failed.
     */
    public TimeoutAction decide(RunRow run) {
        long thresholdMinutes = classifier.thresholdFor(run).toMinutes();
        if (classifier.isFinal(run.requestJson())) {
            return new TimeoutAction(run.id(), run.variantId(), Kind.REFUND,
                "Final render timeout after " + thresholdMinutes + " minutes", config.getRefundCredits());
        }
        if (retriesUsed(run) < 1) {
            return new TimeoutAction(run.id(), run.variantId(), Kind.RETRY,
                "Preview timeout after " + thresholdMinutes + " minutes, retrying", 0);
        }
        return new TimeoutAction(run.id(), run.variantId(), Kind.MARK_FAILED,
            "Preview timeout, max retries exceeded", 0);
    }

    /**
     * @return the action taken, or empty when another writer already resolved the run or
     *     the refund could not be attributed
     */
    @Transactional
    public Optional<TimeoutAction> resolve(RunRow run) {
        TimeoutAction action = decide(run);

        Attribution attribution = null;
        if (action.action() == Kind.REFUND) {
            attribution = refunds.attribute(run.variantId()).orElse(null);
            if (attribution == null) {
                LOG.error("Cannot attribute refund for run {}, leaving it for the next sweep", run.id());
                return Optional.empty();
            }
        }

        String response = Jsons.merge(run.responseJson(), Map.of(
            "error", TIMED_OUT,
            "timeout_action", action.action().value(),
            "timeout_reason", action.reason()
        ));
        if (!jobs.transitionRun(run.id(), RunState.ACTIVE, RunState.FAILED, response, TIMED_OUT)) {
            LOG.info("Run {} already left queued/running, skipping timeout handling", run.id());
            return Optional.empty();
        }

        switch (action.action()) {
            case RETRY -> emit(Outbox.RESUBMISSION_REQUIRED, action, run);
            case REFUND -> {
                if (!refunds.refund(attribution, run.id(), action.creditsToRefund(), action.reason())) {
                    action = new TimeoutAction(run.id(), run.variantId(), Kind.REFUND, action.reason(), 0);
                }
                jobs.updateVariant(run.variantId(), VariantStatus.ERROR);
                emit(Outbox.RUN_REFUNDED, action, run);
            }
            case MARK_FAILED -> {
                jobs.updateVariant(run.variantId(), VariantStatus.ERROR);
                emit(Outbox.RUN_FAILED, action, run);
            }
        }
        LOG.warn("Run {} timed out, action={} reason={}", run.id(), action.action().value(), action.reason());
        return Optional.of(action);
    }

    private int retriesUsed(RunRow run) {
        return jobs.countRetries(run.id()) + (run.retryOf() != null ? 1 : 0);
    }

    private void emit(String type, TimeoutAction action, RunRow run) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", run.id().toString());
        body.put("variantId", run.variantId().toString());
        body.put("engineClass", run.engineClass());
        body.put("action", action.action().value());
        body.put("reason", action.reason());
        body.put("creditsRefunded", action.creditsToRefund());
        var id = outboxStore.addReturningId(outbox.rowRunEvent(type, run.id(), run.variantId(), body));
        fastPath.registerAfterCommit(id);
    }
}
