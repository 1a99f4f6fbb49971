package com.ads.guardian.analysis;

import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.persistence.ManagedEntityEntity;
import com.ads.guardian.platform.MetricsSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Computes pacing and profitability signals for one entity from its current snapshot and
 * a bounded trailing history (last N ticks or last 24h, whichever is smaller).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PerformanceEvaluator {

    static final Duration MAX_LOOKBACK = Duration.ofHours(24);

    private final GuardianSettings settings;

    /**
     * @param history earlier snapshots of the entity, oldest first
     */
    public EntityEvaluation evaluate(ManagedEntityEntity entity, MetricsSnapshot current,
                                     List<MetricsSnapshot> history) {
        double elapsed = current.getElapsedDayFraction() != null
                ? current.getElapsedDayFraction()
                : elapsedDayFraction(current.getTickTime());

        PacingState pacing = PacingState.compute(entity.getDailyBudget(), elapsed, current.getSpend(),
                settings.getOverPaceRatio(), settings.getActiveHours());

        WindowTotals window = MetricsWindow.aggregate(current, history, settings.getHistoryTicks(),
                current.getTickTime().minus(MAX_LOOKBACK));

        ProfitabilitySignal signal = assess(window);

        log.debug("Entity {} pacing={} ({}), profit={} {} {} ({} clicks)",
                entity.getEntityId(), pacing.getPacingRatio(), pacing.getStatus(),
                signal.getProfitEstimate(), signal.getDirection(), signal.getBasis(), signal.getWindowClicks());

        return EntityEvaluation.builder()
                .entityId(entity.getEntityId())
                .campaignId(entity.getCampaignId())
                .kind(entity.getKind())
                .stale(false)
                .snapshot(current)
                .pacing(pacing)
                .signal(signal)
                .intervalSpend(window.getIntervalSpend())
                .intervalValue(attributedValue(window.getIntervalValue(), window.getIntervalConversions()))
                .intervalStart(intervalStart(window, current.getTickTime(), elapsed))
                .build();
    }

    /**
     * Profitability of the window. Value-based when value is reported and positive,
     * otherwise cost per conversion against breakeven.
     */
    public ProfitabilitySignal assess(WindowTotals window) {
        BigDecimal spend = window.getSpend();
        BigDecimal conversions = window.getConversions();
        BigDecimal breakeven = settings.getBreakevenCost();
        Confidence confidence = Confidence.forClicks(window.getClicks(), settings.getMinClicks());

        boolean valueBased = window.getValue() != null && window.getValue().signum() > 0;
        SignalBasis basis = valueBased ? SignalBasis.VALUE_BASED : SignalBasis.PROXY;
        BigDecimal value = valueBased ? window.getValue() : conversions.multiply(breakeven);
        BigDecimal profit = value.subtract(spend);

        SignalDirection direction;
        PerformanceRating rating;

        if (spend.signum() == 0 && window.getClicks() == 0) {
            direction = SignalDirection.NEUTRAL;
            rating = PerformanceRating.ACCEPTABLE;
        } else if (valueBased) {
            direction = directionOf(profit);
            rating = PerformanceRating.forMargin(profit, spend);
        } else {
            BigDecimal lossThreshold = breakeven.multiply(conversions.max(BigDecimal.ONE));
            if (spend.compareTo(lossThreshold) > 0) {
                direction = SignalDirection.NEGATIVE;
            } else {
                direction = profit.signum() > 0 ? SignalDirection.POSITIVE : SignalDirection.NEUTRAL;
            }
            rating = PerformanceRating.forCostPerConversion(spend, conversions, breakeven,
                    window.getClicks(), settings.getMinClicks());
        }

        return ProfitabilitySignal.builder()
                .windowSpend(spend)
                .windowValue(value)
                .windowConversions(conversions)
                .windowClicks(window.getClicks())
                .windowImpressions(window.getImpressions())
                .windowTicks(window.getTicks())
                .profitEstimate(profit)
                .basis(basis)
                .direction(direction)
                .confidence(confidence)
                .rating(rating)
                .build();
    }

    /**
     * Fraction of the configured active day elapsed at the given time, clamped to [0, 1].
     */
    public double elapsedDayFraction(LocalDateTime time) {
        double hour = time.getHour() + time.getMinute() / 60.0 + time.getSecond() / 3600.0;
        double fraction = (hour - settings.getActiveHoursStart()) / settings.getActiveHours();
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    /**
     * Start of the latest interval. Without a previous same-day snapshot the interval holds
     * everything spent since the active day started.
     */
    LocalDateTime intervalStart(WindowTotals window, LocalDateTime tickTime, double elapsed) {
        if (window.getIntervalStart() != null) {
            return window.getIntervalStart();
        }
        long accruedSeconds = Math.round(elapsed * settings.getActiveHours() * 3600);
        return tickTime.minusSeconds(accruedSeconds);
    }

    private BigDecimal attributedValue(BigDecimal reportedValue, BigDecimal conversions) {
        if (reportedValue != null) {
            return reportedValue;
        }
        return conversions.multiply(settings.getBreakevenCost());
    }

    private static SignalDirection directionOf(BigDecimal profit) {
        if (profit.signum() < 0) return SignalDirection.NEGATIVE;
        if (profit.signum() > 0) return SignalDirection.POSITIVE;
        return SignalDirection.NEUTRAL;
    }
}
