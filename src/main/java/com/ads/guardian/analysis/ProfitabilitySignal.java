package com.ads.guardian.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitabilitySignal {

    private BigDecimal windowSpend;
    // reported value, or conversions x breakeven for PROXY signals
    private BigDecimal windowValue;
    private BigDecimal windowConversions;
    private long windowClicks;
    private long windowImpressions;
    private int windowTicks;

    private BigDecimal profitEstimate;
    private SignalBasis basis;
    private SignalDirection direction;
    private Confidence confidence;
    private PerformanceRating rating;

    public boolean isNegative() {
        return direction == SignalDirection.NEGATIVE;
    }
}
