package com.ads.guardian.analysis;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Coarse performance grade reported alongside each signal.
 */
public enum PerformanceRating {

    EXCELLENT("Excellent"),
    GOOD("Good"),
    ACCEPTABLE("Acceptable"),
    POOR("Poor"),
    TERRIBLE("Terrible");

    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);

    private final String displayName;

    PerformanceRating(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Grade by cost per conversion relative to breakeven.
     * Target CPA is 75% of breakeven; EXCELLENT below 70% of target, TERRIBLE above 150% of breakeven.
     */
    public static PerformanceRating forCostPerConversion(BigDecimal spend, BigDecimal conversions,
                                                         BigDecimal breakevenCost, long clicks, int minClicks) {
        if (conversions.signum() == 0) {
            if (spend.compareTo(breakevenCost) > 0) {
                return TERRIBLE;
            }
            return clicks >= minClicks && clicks > 0 ? POOR : ACCEPTABLE;
        }

        BigDecimal cpa = spend.divide(conversions, MC);
        BigDecimal target = breakevenCost.multiply(BigDecimal.valueOf(0.75));

        if (cpa.compareTo(target.multiply(BigDecimal.valueOf(0.7))) < 0) return EXCELLENT;
        if (cpa.compareTo(target) < 0) return GOOD;
        if (cpa.compareTo(breakevenCost) <= 0) return ACCEPTABLE;
        if (cpa.compareTo(breakevenCost.multiply(BigDecimal.valueOf(1.5))) < 0) return POOR;
        return TERRIBLE;
    }

    /**
     * Grade by profit margin (profit / spend) when conversion value is known.
     */
    public static PerformanceRating forMargin(BigDecimal profit, BigDecimal spend) {
        if (spend.signum() == 0) {
            return profit.signum() >= 0 ? GOOD : ACCEPTABLE;
        }
        BigDecimal margin = profit.divide(spend, MC);

        if (margin.compareTo(BigDecimal.ONE) >= 0) return EXCELLENT;
        if (margin.compareTo(BigDecimal.valueOf(0.25)) >= 0) return GOOD;
        if (margin.signum() >= 0) return ACCEPTABLE;
        if (margin.compareTo(BigDecimal.valueOf(-0.5)) >= 0) return POOR;
        return TERRIBLE;
    }
}
