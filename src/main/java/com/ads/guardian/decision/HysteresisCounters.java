package com.ads.guardian.decision;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Consecutive-tick counters behind every transition.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HysteresisCounters {

    private int negativeStreak;
    private int nonNegativeStreak;
    private int haltClearStreak;

    public static HysteresisCounters zero() {
        return new HysteresisCounters(0, 0, 0);
    }

    public HysteresisCounters copy() {
        return toBuilder().build();
    }
}
