package com.acme.render.monitor;

import com.acme.render.config.MessagingConfig;
import com.acme.render.config.TimeoutConfig;
import com.acme.render.core.FastPathPublisher;
import com.acme.render.core.Outbox;
import com.acme.render.ledger.RefundService;
import com.acme.render.spi.CreditLedger;
import com.acme.render.spi.CreditLedger.TransactionType;
import com.acme.render.spi.JobStore;
import com.acme.render.spi.JobStore.ProjectRow;
import com.acme.render.spi.JobStore.RunRow;
import com.acme.render.spi.JobStore.VariantRow;
import com.acme.render.spi.OutboxStore;
import com.acme.render.spi.RunState;
import com.acme.render.spi.VariantStatus;
import com.acme.render.test.MutableClock;
import io.micronaut.scheduling.TaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TimeoutMonitorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private JobStore jobs;
    private CreditLedger ledger;
    private OutboxStore outboxStore;
    private TaskScheduler scheduler;
    private MutableClock clock;
    private TimeoutConfig config;
    private TimeoutMonitor monitor;

    private final UUID userId = UUID.randomUUID();
    private final UUID projectId = UUID.randomUUID();
    private final UUID variantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        jobs = mock(JobStore.class);
        ledger = mock(CreditLedger.class);
        outboxStore = mock(OutboxStore.class);
        scheduler = mock(TaskScheduler.class);
        clock = new MutableClock(NOW);
        config = new TimeoutConfig();

        RunClassifier classifier = new RunClassifier(config);
        TimeoutResolver resolver = new TimeoutResolver(jobs, new RefundService(jobs, ledger), classifier,
            outboxStore, new Outbox(new MessagingConfig()), mock(FastPathPublisher.class), config);
        monitor = new TimeoutMonitor(jobs, resolver, classifier, config, scheduler, clock);

        when(jobs.findVariant(variantId)).thenReturn(Optional.of(new VariantRow(variantId, projectId, VariantStatus.RENDERING)));
        when(jobs.findProject(projectId)).thenReturn(Optional.of(new ProjectRow(projectId, userId)));
        when(jobs.transitionRun(any(), any(), any(), any(), any())).thenReturn(true);
        when(outboxStore.addReturningId(any())).thenReturn(UUID.randomUUID());
        when(ledger.hasTransactionForRun(any(), eq(TransactionType.USAGE))).thenReturn(true);
    }

    private RunRow run(String request, Duration age) {
        return new RunRow(UUID.randomUUID(), variantId, "veo_fast", RunState.RUNNING, request, null, null, null,
            NOW.minus(age));
    }

    private void elapsed(RunRow... runs) {
        when(jobs.getElapsedJobs(eq(RunState.ACTIVE), eq("veo_fast"), any())).thenReturn(List.of(runs));
    }

    @Test
    void testPreviewPastDeadlineIsRetriedWithoutLedgerWrites() {
        RunRow preview = run("{\"duration\":8}", Duration.ofMinutes(11));
        elapsed(preview);

        assertEquals(1, monitor.checkForTimeouts());

        verify(jobs).transitionRun(eq(preview.id()), eq(RunState.ACTIVE), eq(RunState.FAILED), anyString(),
            eq("Generation timed out"));
        verifyNoInteractions(ledger);
        verify(jobs, never()).updateVariant(any(), any());
    }

    @Test
    void testFinalPastDeadlineIsRefundedOnce() {
        RunRow finalRun = run("{\"duration\":24}", Duration.ofMinutes(21));
        elapsed(finalRun);

        assertEquals(1, monitor.checkForTimeouts());

        verify(ledger).appendTransaction(userId, 1, TransactionType.REFUND,
            "Refund: Final render timeout after 20 minutes", projectId, variantId, finalRun.id());
        verify(jobs).updateVariant(variantId, VariantStatus.ERROR);
    }

    @Test
    void testFinalBetweenPreviewAndFinalDeadlineIsLeftAlone() {
        elapsed(run("{\"duration\":24}", Duration.ofMinutes(15)));

        assertEquals(0, monitor.checkForTimeouts());

        verify(jobs, never()).transitionRun(any(), any(), any(), any(), any());
    }

    @Test
    void testRunExactlyAtDeadlineIsNotTimedOut() {
        elapsed(run("{\"duration\":8}", Duration.ofMinutes(10)));

        assertEquals(0, monitor.checkForTimeouts());
    }

    @Test
    void testQueryUsesShortestDeadlineAsCutoff() {
        elapsed();

        monitor.checkForTimeouts();

        verify(jobs).getElapsedJobs(RunState.ACTIVE, "veo_fast", NOW.minus(Duration.ofMinutes(10)));
    }

    @Test
    void testOnlyMonitoredEnginesAreScanned() {
        config.setMonitoredEngines(List.of("veo_fast", "veo_quality"));
        elapsed();
        when(jobs.getElapsedJobs(eq(RunState.ACTIVE), eq("veo_quality"), any())).thenReturn(List.of());

        monitor.checkForTimeouts();

        verify(jobs).getElapsedJobs(eq(RunState.ACTIVE), eq("veo_fast"), any());
        verify(jobs).getElapsedJobs(eq(RunState.ACTIVE), eq("veo_quality"), any());
    }

    @Test
    void testRunResolvedElsewhereIsSkipped() {
        elapsed(run("{\"duration\":24}", Duration.ofMinutes(25)));
        when(jobs.transitionRun(any(), any(), any(), any(), any())).thenReturn(false);

        assertEquals(0, monitor.checkForTimeouts());

        verify(ledger, never()).appendTransaction(any(), anyInt(), any(), any(), any(), any(), any());
        verify(jobs, never()).updateVariant(any(), any());
    }

    @Test
    void testAlreadyRefundedRunIsNotRefundedTwice() {
        RunRow finalRun = run("{\"duration\":24}", Duration.ofMinutes(25));
        elapsed(finalRun);
        when(ledger.hasTransactionForRun(finalRun.id(), TransactionType.REFUND)).thenReturn(true);

        monitor.checkForTimeouts();

        verify(ledger, never()).appendTransaction(any(), anyInt(), any(), any(), any(), any(), any());
    }

    @Test
    void testSecondSweepAfterResolutionWritesNothing() {
        elapsed(run("{\"duration\":8}", Duration.ofMinutes(11)));
        monitor.checkForTimeouts();

        // the run is failed now, so the store no longer reports it
        elapsed();
        clearInvocations(jobs, ledger, outboxStore);

        assertEquals(0, monitor.checkForTimeouts());
        verify(jobs, never()).transitionRun(any(), any(), any(), any(), any());
        verifyNoInteractions(ledger, outboxStore);
    }

    @Test
    void testOneFailingRunDoesNotStopTheSweep() {
        RunRow broken = run("{\"duration\":24}", Duration.ofMinutes(30));
        RunRow fine = run("{\"duration\":8}", Duration.ofMinutes(30));
        elapsed(broken, fine);
        when(ledger.appendTransaction(any(), anyInt(), any(), any(), any(), any(), eq(broken.id())))
            .thenThrow(new RuntimeException("ledger unavailable"));

        assertEquals(1, monitor.checkForTimeouts());

        verify(jobs).transitionRun(eq(fine.id()), any(), any(), any(), any());
    }

    @Test
    void testStoreFailureAbortsOnlyThisSweep() {
        when(jobs.getElapsedJobs(any(), any(), any())).thenThrow(new RuntimeException("connection lost"));

        assertEquals(0, monitor.checkForTimeouts());
    }

    @Test
    void testStartAndStopAreIdempotent() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(), any(), any(Runnable.class));

        monitor.startMonitoring();
        monitor.startMonitoring();
        assertTrue(monitor.isMonitoring());
        verify(scheduler, times(1)).scheduleWithFixedDelay(eq(Duration.ZERO), eq(Duration.ofSeconds(60)), any(Runnable.class));

        monitor.stopMonitoring();
        monitor.stopMonitoring();
        assertFalse(monitor.isMonitoring());
        verify(future, times(1)).cancel(false);
    }

    @Test
    void testCanRestartAfterStop() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(), any(), any(Runnable.class));

        monitor.startMonitoring();
        monitor.stopMonitoring();
        monitor.startMonitoring();

        assertTrue(monitor.isMonitoring());
        verify(scheduler, times(2)).scheduleWithFixedDelay(any(), any(), any(Runnable.class));
    }

    @Test
    void testCheckRunTimeout() {
        RunRow preview = run("{\"duration\":8}", Duration.ofMinutes(11));
        when(jobs.findRun(preview.id())).thenReturn(Optional.of(preview));

        RunTimeoutStatus status = monitor.checkRunTimeout(preview.id());

        assertTrue(status.isTimedOut());
        assertEquals(660_000L, status.runningTimeMs());
        assertEquals(600_000L, status.timeoutThresholdMs());
    }

    @Test
    void testCheckRunTimeoutForFinalWithinDeadline() {
        RunRow finalRun = run("{\"duration\":24}", Duration.ofMinutes(15));
        when(jobs.findRun(finalRun.id())).thenReturn(Optional.of(finalRun));

        RunTimeoutStatus status = monitor.checkRunTimeout(finalRun.id());

        assertFalse(status.isTimedOut());
        assertEquals(1_200_000L, status.timeoutThresholdMs());
    }

    @Test
    void testCheckRunTimeoutForUnknownRun() {
        when(jobs.findRun(any())).thenReturn(Optional.empty());

        RunTimeoutStatus status = monitor.checkRunTimeout(UUID.randomUUID());

        assertFalse(status.isTimedOut());
        assertEquals(0L, status.runningTimeMs());
        assertEquals(0L, status.timeoutThresholdMs());
    }
}
