package com.acme.render.ledger;

import com.acme.render.spi.CreditLedger;
import com.acme.render.spi.CreditLedger.TransactionType;
import com.acme.render.spi.JobStore;
import jakarta.inject.Singleton;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compensating ledger entries for runs that did not deliver. At most one refund is written per
 * run, and only against a usage entry for that run.
 */
@Singleton
public class RefundService {
    private static final Logger LOG = LoggerFactory.getLogger(RefundService.class);

    private final JobStore jobs;
    private final CreditLedger ledger;

    public RefundService(JobStore jobs, CreditLedger ledger) {
        this.jobs = jobs;
        this.ledger = ledger;
    }

    /**
     * Resolves variant -> project -> owning user. Empty when either hop is missing.
     */
    public Optional<Attribution> attribute(UUID variantId) {
        var variant = jobs.findVariant(variantId);
        if (variant.isEmpty()) {
            LOG.error("Variant {} not found for refund", variantId);
            return Optional.empty();
        }
        UUID projectId = variant.get().projectId();
        var project = jobs.findProject(projectId);
        if (project.isEmpty() || project.get().userId() == null) {
            LOG.error("Project {} not found for refund of variant {}", projectId, variantId);
            return Optional.empty();
        }
        return Optional.of(new Attribution(project.get().userId(), projectId, variantId));
    }

    /**
     * Only runs that were debited get a refund.
     *
     * @return false when the run was never charged or has already been refunded
     */
    public boolean refund(Attribution to, UUID runId, int credits, String reason) {
        if (!ledger.hasTransactionForRun(runId, TransactionType.USAGE)) {
            LOG.info("Run {} was never charged, nothing to refund", runId);
            return false;
        }
        if (ledger.hasTransactionForRun(runId, TransactionType.REFUND)) {
            LOG.info("Run {} already refunded, not refunding again", runId);
            return false;
        }
        ledger.appendTransaction(to.userId(), credits, TransactionType.REFUND, "Refund: " + reason,
            to.projectId(), to.variantId(), runId);
        LOG.info("Refunded {} credits to user {} for run {}: {}", credits, to.userId(), runId, reason);
        return true;
    }

    public record Attribution(UUID userId, UUID projectId, UUID variantId) {}
}
