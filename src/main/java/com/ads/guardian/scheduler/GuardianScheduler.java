package com.ads.guardian.scheduler;

import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.service.GuardianContext;
import com.ads.guardian.service.GuardianTickService;
import com.ads.guardian.service.TickOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fires ticks at a fixed rate. A trigger that finds a tick in flight is recorded as
 * SKIPPED and dropped, never queued.
 */
@Component
@Slf4j
public class GuardianScheduler {

    private final GuardianContext context;
    private final GuardianTickService tickService;
    private final ExecutorService tickExecutor;

    public GuardianScheduler(GuardianContext context,
                             GuardianTickService tickService,
                             @Qualifier("guardianTickExecutor") ExecutorService tickExecutor) {
        this.context = context;
        this.tickService = tickService;
        this.tickExecutor = tickExecutor;
    }

    @Scheduled(fixedRateString = "${guardian.tick.interval-ms:900000}",
            initialDelayString = "${guardian.tick.initial-delay-ms:60000}")
    public void trigger() {
        LocalDateTime tickTime = tickService.currentTickTime();

        try {
            if (context.isShuttingDown()) {
                log.info("Tick {} not started: shutting down", tickTime);
                return;
            }
            if (!context.isEnabled()) {
                tickService.recordDisabled(tickTime);
                return;
            }
            if (!context.tryBeginTick()) {
                tickService.recordSkipped(tickTime, "Previous tick still in flight");
                return;
            }
        } catch (Exception e) {
            log.error("Error handling tick trigger {}: {}", tickTime, e.getMessage(), e);
            return;
        }

        try {
            tickExecutor.execute(() -> runClaimedTick(tickTime));
        } catch (RejectedExecutionException e) {
            log.error("Tick {} rejected by executor: {}", tickTime, e.getMessage());
            context.endTick(tickTime, TickOutcome.ABORTED);
        }
    }

    private void runClaimedTick(LocalDateTime tickTime) {
        TickOutcome outcome = TickOutcome.ABORTED;
        try {
            TickRecordEntity record = tickService.runTick(tickTime);
            outcome = record.getOutcome();
        } catch (Exception e) {
            log.error("Error during tick {}: {}", tickTime, e.getMessage(), e);
        } finally {
            context.endTick(tickTime, outcome);
        }
    }
}
