package com.ads.guardian.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PacingState {

    private static final BigDecimal UNDER_PACE_RATIO = BigDecimal.valueOf(0.5);

    private BigDecimal dailyBudget;
    private double elapsedDayFraction;
    private BigDecimal targetSpendByNow;
    private BigDecimal actualSpend;

    // null when targetSpendByNow is zero
    private BigDecimal pacingRatio;

    private PacingStatus status;

    // remaining budget spread over remaining active hours, null at end of day
    private BigDecimal recommendedHourlySpend;

    /**
     * Compute pacing. A zero target yields NO_SIGNAL with a null ratio; no division happens.
     */
    public static PacingState compute(BigDecimal dailyBudget, double elapsedDayFraction, BigDecimal actualSpend,
                                      BigDecimal overPaceRatio, int activeHours) {
        BigDecimal budget = dailyBudget != null ? dailyBudget : BigDecimal.ZERO;
        BigDecimal spend = actualSpend != null ? actualSpend : BigDecimal.ZERO;
        double elapsed = Math.max(0.0, Math.min(1.0, elapsedDayFraction));

        BigDecimal target = budget.multiply(BigDecimal.valueOf(elapsed)).setScale(4, RoundingMode.HALF_UP);

        BigDecimal ratio = null;
        PacingStatus status = PacingStatus.NO_SIGNAL;
        if (target.signum() > 0) {
            ratio = spend.divide(target, 4, RoundingMode.HALF_UP);
            if (ratio.compareTo(overPaceRatio) > 0) {
                status = PacingStatus.OVER_PACE;
            } else if (ratio.compareTo(UNDER_PACE_RATIO) < 0) {
                status = PacingStatus.UNDER_PACE;
            } else {
                status = PacingStatus.ON_PACE;
            }
        }

        BigDecimal recommended = null;
        double remainingHours = (1.0 - elapsed) * activeHours;
        if (remainingHours > 0) {
            BigDecimal remainingBudget = budget.subtract(spend).max(BigDecimal.ZERO);
            recommended = remainingBudget.divide(BigDecimal.valueOf(remainingHours), 2, RoundingMode.HALF_UP);
        }

        return PacingState.builder()
                .dailyBudget(budget)
                .elapsedDayFraction(elapsed)
                .targetSpendByNow(target)
                .actualSpend(spend)
                .pacingRatio(ratio)
                .status(status)
                .recommendedHourlySpend(recommended)
                .build();
    }

    public boolean hasSignal() {
        return pacingRatio != null;
    }
}
