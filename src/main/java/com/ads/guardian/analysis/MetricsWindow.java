package com.ads.guardian.analysis;

import com.ads.guardian.platform.MetricsSnapshot;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns day-cumulative snapshots into trailing-window totals.
 *
 * Each snapshot contributes its delta against the previous snapshot. On a day rollover
 * (new calendar day or a counter going down) the snapshot contributes its own values.
 */
public final class MetricsWindow {

    private MetricsWindow() {
    }

    /**
     * @param current   snapshot of this tick
     * @param history   earlier snapshots of the same entity, oldest first
     * @param maxTicks  max number of intervals in the window, current included
     * @param since     intervals ending before this time are outside the window
     */
    public static WindowTotals aggregate(MetricsSnapshot current, List<MetricsSnapshot> history,
                                         int maxTicks, LocalDateTime since) {
        List<MetricsSnapshot> series = new ArrayList<>(history);
        series.add(current);

        int firstInWindow = Math.max(0, series.size() - maxTicks);

        BigDecimal spend = BigDecimal.ZERO;
        BigDecimal conversions = BigDecimal.ZERO;
        BigDecimal value = null;
        long clicks = 0;
        long impressions = 0;
        int ticks = 0;

        Delta latest = null;
        for (int i = firstInWindow; i < series.size(); i++) {
            MetricsSnapshot snapshot = series.get(i);
            boolean isCurrent = i == series.size() - 1;
            if (!isCurrent && snapshot.getTickTime() != null && snapshot.getTickTime().isBefore(since)) {
                continue;
            }

            Delta delta = Delta.between(i > 0 ? series.get(i - 1) : null, snapshot);
            spend = spend.add(delta.spend);
            conversions = conversions.add(delta.conversions);
            if (delta.value != null) {
                value = value == null ? delta.value : value.add(delta.value);
            }
            clicks += delta.clicks;
            impressions += delta.impressions;
            ticks++;
            latest = delta;
        }

        return WindowTotals.builder()
                .spend(spend)
                .conversions(conversions)
                .value(value)
                .clicks(clicks)
                .impressions(impressions)
                .ticks(ticks)
                .intervalSpend(latest.spend)
                .intervalConversions(latest.conversions)
                .intervalValue(latest.value)
                .intervalStart(latest.since)
                .build();
    }

    private static final class Delta {
        private BigDecimal spend;
        private BigDecimal conversions;
        private BigDecimal value;
        private long clicks;
        private long impressions;
        private LocalDateTime since;

        static Delta between(MetricsSnapshot previous, MetricsSnapshot current) {
            Delta delta = new Delta();
            boolean rollover = previous == null || isRollover(previous, current);

            delta.spend = orZero(current.getSpend());
            delta.conversions = orZero(current.getConversions());
            delta.value = current.getConversionValue();
            delta.clicks = current.getClicks();
            delta.impressions = current.getImpressions();

            if (!rollover) {
                delta.since = previous.getTickTime();
                delta.spend = delta.spend.subtract(orZero(previous.getSpend()));
                delta.conversions = delta.conversions.subtract(orZero(previous.getConversions())).max(BigDecimal.ZERO);
                if (delta.value != null && previous.getConversionValue() != null) {
                    delta.value = delta.value.subtract(previous.getConversionValue()).max(BigDecimal.ZERO);
                }
                delta.clicks -= previous.getClicks();
                delta.impressions = Math.max(0, delta.impressions - previous.getImpressions());
            }
            return delta;
        }

        private static boolean isRollover(MetricsSnapshot previous, MetricsSnapshot current) {
            if (previous.getTickTime() != null && current.getTickTime() != null
                    && !previous.getTickTime().toLocalDate().equals(current.getTickTime().toLocalDate())) {
                return true;
            }
            return orZero(current.getSpend()).compareTo(orZero(previous.getSpend())) < 0
                    || current.getClicks() < previous.getClicks();
        }

        private static BigDecimal orZero(BigDecimal value) {
            return value != null ? value : BigDecimal.ZERO;
        }
    }
}
