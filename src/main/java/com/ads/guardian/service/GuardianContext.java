package com.ads.guardian.service;

import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.decision.LifecycleState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide guardian state: the enable switch and the single in-flight tick slot.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GuardianContext {

    private final GuardianSettings settings;
    private final GuardianStateStore stateStore;

    @Value("${guardian.shutdown.await-seconds:30}")
    private long shutdownAwaitSeconds;

    private final AtomicBoolean enabled = new AtomicBoolean(false);
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    private volatile LocalDateTime lastTickTime;
    private volatile TickOutcome lastOutcome;

    @PostConstruct
    public void init() {
        settings.validate();
        enabled.set(settings.isEnabledOnStartup());

        Map<LifecycleState, Long> counts = stateStore.countStates();
        log.info("Guardian context initialized: enabled={}, interval={}ms, states={}",
                enabled.get(), settings.getTickIntervalMs(), counts);
    }

    /**
     * Stop accepting ticks and wait, bounded, for the running one to finish.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        lock.lock();
        try {
            long remaining = TimeUnit.SECONDS.toNanos(shutdownAwaitSeconds);
            while (inFlight.get() && remaining > 0) {
                remaining = idle.awaitNanos(remaining);
            }
            if (inFlight.get()) {
                log.warn("Shutting down with a tick still in flight after {}s", shutdownAwaitSeconds);
            } else {
                log.info("Guardian context stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight tick");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim the tick slot. False when a tick is already running or the context is stopping.
     */
    public boolean tryBeginTick() {
        if (shuttingDown.get()) {
            return false;
        }
        return inFlight.compareAndSet(false, true);
    }

    public void endTick(LocalDateTime tickTime, TickOutcome outcome) {
        lastTickTime = tickTime;
        lastOutcome = outcome;
        releaseSlot();
    }

    /**
     * Free the slot without recording a tick. Used by operator transitions that held it.
     */
    public void releaseSlot() {
        lock.lock();
        try {
            inFlight.set(false);
            idle.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isTickInFlight() {
        return inFlight.get();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public void enable() {
        if (!enabled.getAndSet(true)) {
            log.info("Guardian enabled");
        }
    }

    public void disable() {
        if (enabled.getAndSet(false)) {
            log.info("Guardian disabled");
        }
    }

    public boolean toggle() {
        boolean now = !enabled.get();
        if (now) enable(); else disable();
        return now;
    }

    public LocalDateTime getLastTickTime() {
        return lastTickTime;
    }

    public TickOutcome getLastOutcome() {
        return lastOutcome;
    }
}
