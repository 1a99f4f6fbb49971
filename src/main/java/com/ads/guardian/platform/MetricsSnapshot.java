package com.ads.guardian.platform;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One fetch result for one entity at one tick.
 * Counters are cumulative for the current reporting day.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    private String entityId;
    private LocalDateTime tickTime;

    private BigDecimal spend;
    private BigDecimal conversions;

    // null when the platform does not report conversion value
    private BigDecimal conversionValue;

    private long clicks;
    private long impressions;

    // 0.0 - 1.0, null when the platform omits it
    private Double elapsedDayFraction;

    public boolean hasConversionValue() {
        return conversionValue != null;
    }
}
