package com.ads.guardian.scheduler;

import com.ads.guardian.persistence.TickRecordEntity;
import com.ads.guardian.service.GuardianContext;
import com.ads.guardian.service.GuardianTickService;
import com.ads.guardian.service.TickOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("GuardianScheduler Tests")
class GuardianSchedulerTest {

    private static final LocalDateTime TICK = LocalDateTime.of(2024, 3, 4, 12, 0);

    private GuardianContext context;
    private GuardianTickService tickService;
    private ExecutorService executor;
    private GuardianScheduler scheduler;

    @BeforeEach
    void setUp() {
        context = mock(GuardianContext.class);
        tickService = mock(GuardianTickService.class);
        executor = Executors.newSingleThreadExecutor();
        scheduler = new GuardianScheduler(context, tickService, executor);
        when(tickService.currentTickTime()).thenReturn(TICK);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void drain() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Disabled guardian records a DISABLED tick")
    void disabledRecorded() throws InterruptedException {
        when(context.isEnabled()).thenReturn(false);

        scheduler.trigger();
        drain();

        verify(tickService).recordDisabled(TICK);
        verify(tickService, never()).runTick(any());
        verify(context, never()).tryBeginTick();
    }

    @Test
    @DisplayName("Trigger during an in-flight tick is skipped, not queued")
    void inFlightSkipped() throws InterruptedException {
        when(context.isEnabled()).thenReturn(true);
        when(context.tryBeginTick()).thenReturn(false);

        scheduler.trigger();
        drain();

        verify(tickService).recordSkipped(eq(TICK), anyString());
        verify(tickService, never()).runTick(any());
    }

    @Test
    @DisplayName("Claimed tick runs and releases the slot")
    void claimedTickRuns() throws InterruptedException {
        when(context.isEnabled()).thenReturn(true);
        when(context.tryBeginTick()).thenReturn(true);
        when(tickService.runTick(TICK)).thenReturn(TickRecordEntity.builder()
                .tickTime(TICK).outcome(TickOutcome.COMPLETED).build());

        scheduler.trigger();
        drain();

        verify(tickService).runTick(TICK);
        verify(context).endTick(TICK, TickOutcome.COMPLETED);
    }

    @Test
    @DisplayName("Slot is released as ABORTED when the tick throws")
    void slotReleasedOnError() throws InterruptedException {
        when(context.isEnabled()).thenReturn(true);
        when(context.tryBeginTick()).thenReturn(true);
        when(tickService.runTick(TICK)).thenThrow(new IllegalStateException("boom"));

        scheduler.trigger();
        drain();

        verify(context).endTick(TICK, TickOutcome.ABORTED);
    }

    @Test
    @DisplayName("Nothing happens while shutting down")
    void shuttingDown() throws InterruptedException {
        when(context.isShuttingDown()).thenReturn(true);

        scheduler.trigger();
        drain();

        verify(tickService, never()).recordDisabled(any());
        verify(tickService, never()).runTick(any());
    }
}
