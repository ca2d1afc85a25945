package com.acme.render.monitor;

import com.acme.render.config.TimeoutConfig;
import com.acme.render.spi.JobStore;
import com.acme.render.spi.JobStore.RunRow;
import com.acme.render.spi.RunState;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically sweeps queued/running renders whose deadline has passed and hands each one
 * to {@link TimeoutResolver}. A failing run or sweep is logged and the next one proceeds.
 */
@Singleton
public class TimeoutMonitor {
    private static final Logger LOG = LoggerFactory.getLogger(TimeoutMonitor.class);

    private final JobStore jobs;
    private final TimeoutResolver resolver;
    private final RunClassifier classifier;
    private final TimeoutConfig config;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private ScheduledFuture<?> task;

    public TimeoutMonitor(
        JobStore jobs,
        TimeoutResolver resolver,
        RunClassifier classifier,
        TimeoutConfig config,
        @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler,
        Clock clock
    ) {
        this.jobs = jobs;
        this.resolver = resolver;
        this.classifier = classifier;
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public synchronized void startMonitoring() {
        if (task != null) {
            LOG.warn("Timeout monitor already running");
            return;
        }
        Duration interval = config.getCheckInterval();
        LOG.info("Starting timeout monitor: interval={} preview={} final={}",
            interval, config.getPreviewTimeout(), config.getFinalTimeout());
        task = scheduler.scheduleWithFixedDelay(Duration.ZERO, interval, this::checkForTimeouts);
    }

    @PreDestroy
    public synchronized void stopMonitoring() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        LOG.info("Timeout monitor stopped");
    }

    public synchronized boolean isMonitoring() {
        return task != null;
    }

    /**
     * One sweep.
     *
     * @return number of runs this sweep resolved
     */
    public int checkForTimeouts() {
        List<RunRow> elapsed;
        try {
            elapsed = findTimedOutRuns();
        } catch (Exception e) {
            LOG.error("Timeout sweep failed to load runs", e);
            return 0;
        }
        if (elapsed.isEmpty()) {
            LOG.debug("No timed out runs");
            return 0;
        }
        LOG.warn("Found {} timed out runs", elapsed.size());

        int resolved = 0;
        for (RunRow run : elapsed) {
            try {
                if (resolver.resolve(run).isPresent()) {
                    resolved++;
                }
            } catch (Exception e) {
                LOG.error("Failed to handle timeout of run {}", run.id(), e);
            }
        }
        return resolved;
    }

    List<RunRow> findTimedOutRuns() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.getShortestTimeout());
        List<RunRow> out = new ArrayList<>();
        for (String engine : config.getMonitoredEngines()) {
            for (RunRow run : jobs.getElapsedJobs(RunState.ACTIVE, engine, cutoff)) {
                long running = Duration.between(run.createdAt(), now).toMillis();
                if (running > classifier.thresholdFor(run).toMillis()) {
                    out.add(run);
                }
            }
        }
        return out;
    }

    /**
     * Time-based view of a single run; does not look at the run state.
     */
    public RunTimeoutStatus checkRunTimeout(UUID runId) {
        return jobs.findRun(runId)
            .map(run -> {
                long running = Math.max(0L, Duration.between(run.createdAt(), clock.instant()).toMillis());
                long threshold = classifier.thresholdFor(run).toMillis();
                return new RunTimeoutStatus(running > threshold, running, threshold);
            })
            .orElseGet(RunTimeoutStatus::unknown);
    }
}
