package com.ads.guardian.analysis;

public enum PacingStatus {
    /** Target spend by now is zero: nothing to compare against yet. */
    NO_SIGNAL,
    UNDER_PACE,
    ON_PACE,
    OVER_PACE
}
