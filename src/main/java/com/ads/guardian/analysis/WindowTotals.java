package com.ads.guardian.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Trailing-window sums of per-interval deltas, plus the latest interval on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowTotals {

    private BigDecimal spend;
    private BigDecimal conversions;
    // null when no snapshot in the window reported value
    private BigDecimal value;
    private long clicks;
    private long impressions;
    private int ticks;

    private BigDecimal intervalSpend;
    private BigDecimal intervalConversions;
    private BigDecimal intervalValue;
    // tick of the previous same-day snapshot, null when the latest interval runs from the day start
    private LocalDateTime intervalStart;
}
