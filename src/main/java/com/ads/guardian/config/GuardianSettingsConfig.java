package com.ads.guardian.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Binds guardian.* properties. A missing loss limit or a malformed threshold fails
 * context startup, so the scheduler never runs with an unsafe configuration.
 */
@Configuration
@Slf4j
public class GuardianSettingsConfig {

    @Bean
    public GuardianSettings guardianSettings(
            @Value("${guardian.tick.interval-ms:900000}") long tickIntervalMs,
            @Value("${guardian.enabled:false}") boolean enabled,
            @Value("${guardian.worker.pool-size:4}") int workerPoolSize,
            @Value("${guardian.decision.hysteresis-ticks:2}") int hysteresisTicks,
            @Value("${guardian.evaluation.min-clicks:10}") int minClicks,
            @Value("${guardian.evaluation.breakeven-cost:50}") String breakevenCost,
            @Value("${guardian.evaluation.over-pace-ratio:1.5}") String overPaceRatio,
            @Value("${guardian.evaluation.history-ticks:8}") int historyTicks,
            @Value("${guardian.evaluation.proxy-requires-high-confidence:false}") boolean proxyRequiresHighConfidence,
            @Value("${guardian.active-hours.start:0}") int activeHoursStart,
            @Value("${guardian.active-hours.end:24}") int activeHoursEnd,
            @Value("${guardian.protection.absolute-loss-limit:}") String absoluteLossLimit,
            @Value("${guardian.protection.loss-rate-limit:}") String lossRateLimit,
            @Value("${guardian.protection.acceptable-loss-per-interval:0}") String acceptableLoss,
            @Value("${guardian.protection.window-hours:24}") int windowHours,
            @Value("${guardian.action.max-retries:3}") int actionMaxRetries,
            @Value("${guardian.action.backoff-base-ms:500}") long backoffBaseMs,
            @Value("${guardian.action.backoff-max-ms:30000}") long backoffMaxMs,
            @Value("${guardian.action.backoff-jitter:0.2}") double backoffJitter,
            @Value("${guardian.fetch.max-retries:2}") int fetchMaxRetries,
            @Value("${guardian.fetch.requests-per-second:5}") double fetchRequestsPerSecond) {

        GuardianSettings settings = GuardianSettings.builder()
                .tickIntervalMs(tickIntervalMs)
                .enabledOnStartup(enabled)
                .workerPoolSize(workerPoolSize)
                .hysteresisTicks(hysteresisTicks)
                .minClicks(minClicks)
                .breakevenCost(parseDecimal("guardian.evaluation.breakeven-cost", breakevenCost))
                .overPaceRatio(parseDecimal("guardian.evaluation.over-pace-ratio", overPaceRatio))
                .historyTicks(historyTicks)
                .proxyRequiresHighConfidence(proxyRequiresHighConfidence)
                .activeHoursStart(activeHoursStart)
                .activeHoursEnd(activeHoursEnd)
                .absoluteLossLimit(parseDecimal("guardian.protection.absolute-loss-limit", absoluteLossLimit))
                .lossRateLimit(parseDecimal("guardian.protection.loss-rate-limit", lossRateLimit))
                .acceptableLossPerInterval(parseDecimal("guardian.protection.acceptable-loss-per-interval", acceptableLoss))
                .lossWindowHours(windowHours)
                .actionMaxRetries(actionMaxRetries)
                .actionBackoffBaseMs(backoffBaseMs)
                .actionBackoffMaxMs(backoffMaxMs)
                .backoffJitterRatio(backoffJitter)
                .fetchMaxRetries(fetchMaxRetries)
                .fetchRequestsPerSecond(fetchRequestsPerSecond)
                .build()
                .validate();

        log.info("Guardian settings: interval={}ms, K={}, minClicks={}, breakeven={}, lossLimit={}, rateLimit={}/h",
                settings.getTickIntervalMs(), settings.getHysteresisTicks(), settings.getMinClicks(),
                settings.getBreakevenCost(), settings.getAbsoluteLossLimit(), settings.getLossRateLimit());
        return settings;
    }

    /**
     * Blank means "not configured" and yields null; anything unparsable is fatal.
     */
    static BigDecimal parseDecimal(String property, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new GuardianConfigurationException("Malformed value for " + property + ": '" + raw + "'", e);
        }
    }
}
