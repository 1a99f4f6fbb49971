package com.ads.guardian.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunable thresholds of the guardian control loop.
 * Loss limits have no defaults: they must be configured per deployment.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GuardianSettings {

    // Scheduling
    @Builder.Default
    private long tickIntervalMs = 900_000L;
    @Builder.Default
    private boolean enabledOnStartup = false;
    @Builder.Default
    private int workerPoolSize = 4;

    // Decision
    @Builder.Default
    private int hysteresisTicks = 2;

    // Evaluation
    @Builder.Default
    private int minClicks = 10;
    @Builder.Default
    private BigDecimal breakevenCost = BigDecimal.valueOf(50);
    @Builder.Default
    private BigDecimal overPaceRatio = BigDecimal.valueOf(1.5);
    @Builder.Default
    private int historyTicks = 8;
    @Builder.Default
    private boolean proxyRequiresHighConfidence = false;
    @Builder.Default
    private int activeHoursStart = 0;
    @Builder.Default
    private int activeHoursEnd = 24;

    // Capital protection
    private BigDecimal absoluteLossLimit;
    private BigDecimal lossRateLimit;
    @Builder.Default
    private BigDecimal acceptableLossPerInterval = BigDecimal.ZERO;
    @Builder.Default
    private int lossWindowHours = 24;

    // Action applier
    @Builder.Default
    private int actionMaxRetries = 3;
    @Builder.Default
    private long actionBackoffBaseMs = 500L;
    @Builder.Default
    private long actionBackoffMaxMs = 30_000L;
    @Builder.Default
    private double backoffJitterRatio = 0.2;

    // Fetcher
    @Builder.Default
    private int fetchMaxRetries = 2;
    @Builder.Default
    private double fetchRequestsPerSecond = 5.0;

    public Duration getTickInterval() {
        return Duration.ofMillis(tickIntervalMs);
    }

    public Duration getLossWindow() {
        return Duration.ofHours(lossWindowHours);
    }

    public int getActiveHours() {
        return activeHoursEnd - activeHoursStart;
    }

    /**
     * Check every threshold. Throws on the first violation found.
     */
    public GuardianSettings validate() {
        require(tickIntervalMs > 0, "guardian.tick.interval-ms must be positive");
        require(workerPoolSize >= 1, "guardian.worker.pool-size must be at least 1");
        require(hysteresisTicks >= 1, "guardian.decision.hysteresis-ticks must be at least 1");
        require(minClicks >= 0, "guardian.evaluation.min-clicks must not be negative");
        require(breakevenCost != null && breakevenCost.signum() > 0,
                "guardian.evaluation.breakeven-cost must be positive");
        require(overPaceRatio != null && overPaceRatio.compareTo(BigDecimal.ONE) > 0,
                "guardian.evaluation.over-pace-ratio must be greater than 1");
        require(historyTicks >= 1, "guardian.evaluation.history-ticks must be at least 1");
        require(activeHoursStart >= 0 && activeHoursStart < activeHoursEnd && activeHoursEnd <= 24,
                "guardian.active-hours must satisfy 0 <= start < end <= 24");

        require(absoluteLossLimit != null, "guardian.protection.absolute-loss-limit is required");
        require(absoluteLossLimit.signum() > 0, "guardian.protection.absolute-loss-limit must be positive");
        require(lossRateLimit != null, "guardian.protection.loss-rate-limit is required");
        require(lossRateLimit.signum() > 0, "guardian.protection.loss-rate-limit must be positive");
        require(acceptableLossPerInterval != null && acceptableLossPerInterval.signum() >= 0,
                "guardian.protection.acceptable-loss-per-interval must not be negative");
        require(lossWindowHours >= 1, "guardian.protection.window-hours must be at least 1");

        require(actionMaxRetries >= 0, "guardian.action.max-retries must not be negative");
        require(actionBackoffBaseMs > 0, "guardian.action.backoff-base-ms must be positive");
        require(actionBackoffMaxMs >= actionBackoffBaseMs,
                "guardian.action.backoff-max-ms must not be lower than backoff-base-ms");
        require(backoffJitterRatio >= 0.0 && backoffJitterRatio < 1.0,
                "guardian.action.backoff-jitter must be in [0, 1)");
        require(fetchMaxRetries >= 0, "guardian.fetch.max-retries must not be negative");
        require(fetchRequestsPerSecond > 0, "guardian.fetch.requests-per-second must be positive");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new GuardianConfigurationException(message);
        }
    }
}
