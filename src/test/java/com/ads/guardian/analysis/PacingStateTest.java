package com.ads.guardian.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("PacingState Tests")
class PacingStateTest {

    private static final BigDecimal OVER_PACE = BigDecimal.valueOf(1.5);

    @Test
    @DisplayName("Zero target yields no signal without dividing")
    void zeroTargetHasNoSignal() {
        assertThatCode(() -> PacingState.compute(BigDecimal.valueOf(100), 0.0, BigDecimal.valueOf(10), OVER_PACE, 24))
                .doesNotThrowAnyException();

        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.0, BigDecimal.valueOf(10), OVER_PACE, 24);

        assertThat(pacing.getPacingRatio()).isNull();
        assertThat(pacing.getStatus()).isEqualTo(PacingStatus.NO_SIGNAL);
        assertThat(pacing.hasSignal()).isFalse();
    }

    @Test
    @DisplayName("Zero budget yields no signal")
    void zeroBudgetHasNoSignal() {
        PacingState pacing = PacingState.compute(BigDecimal.ZERO, 0.5, BigDecimal.valueOf(10), OVER_PACE, 24);

        assertThat(pacing.getPacingRatio()).isNull();
        assertThat(pacing.getStatus()).isEqualTo(PacingStatus.NO_SIGNAL);
    }

    @Test
    @DisplayName("80 spent of 100 at half day is 1.6 and over pace")
    void overPace() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.5, BigDecimal.valueOf(80), OVER_PACE, 24);

        assertThat(pacing.getTargetSpendByNow()).isEqualByComparingTo("50");
        assertThat(pacing.getPacingRatio()).isEqualByComparingTo("1.6");
        assertThat(pacing.getStatus()).isEqualTo(PacingStatus.OVER_PACE);
    }

    @Test
    @DisplayName("Ratio exactly at the threshold is on pace")
    void thresholdIsOnPace() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.5, BigDecimal.valueOf(75), OVER_PACE, 24);

        assertThat(pacing.getPacingRatio()).isEqualByComparingTo("1.5");
        assertThat(pacing.getStatus()).isEqualTo(PacingStatus.ON_PACE);
    }

    @Test
    @DisplayName("Spend below half of target is under pace")
    void underPace() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.5, BigDecimal.valueOf(20), OVER_PACE, 24);

        assertThat(pacing.getStatus()).isEqualTo(PacingStatus.UNDER_PACE);
    }

    @Test
    @DisplayName("Recommended hourly spend spreads remaining budget over remaining hours")
    void recommendedHourlySpend() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.5, BigDecimal.valueOf(40), OVER_PACE, 24);

        // 60 left over 12 hours
        assertThat(pacing.getRecommendedHourlySpend()).isEqualByComparingTo("5.00");
    }

    @Test
    @DisplayName("No recommendation at the end of the day")
    void noRecommendationAtEndOfDay() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 1.0, BigDecimal.valueOf(40), OVER_PACE, 24);

        assertThat(pacing.getRecommendedHourlySpend()).isNull();
    }

    @Test
    @DisplayName("Overspent budget recommends zero")
    void overspentRecommendsZero() {
        PacingState pacing = PacingState.compute(BigDecimal.valueOf(100), 0.5, BigDecimal.valueOf(120), OVER_PACE, 24);

        assertThat(pacing.getRecommendedHourlySpend()).isEqualByComparingTo("0");
    }
}
