package com.ads.guardian.decision;

public enum ReasonCode {

    // No change
    PROFITABLE,
    NEUTRAL_SIGNAL,
    STALE_METRICS,
    NEGATIVE_PENDING_HYSTERESIS,
    RECOVERY_PENDING_HYSTERESIS,
    STILL_UNPROFITABLE,

    // Re-pace
    OVER_PACE,
    LOW_CONFIDENCE_NEGATIVE,

    // Guardian pause / resume
    NEGATIVE_PROFIT_VALUE,
    NEGATIVE_PROFIT_PROXY,
    PROFITABILITY_RECOVERED,

    // Circuit halt
    CIRCUIT_HALT_ASSERTED,
    CIRCUIT_HALT_ACTIVE,
    HALT_CLEARED_PENDING_REEVALUATION,
    CIRCUIT_HALT_CLEARED,

    // Manual
    MANUAL_PAUSE_OBSERVED,
    OPERATOR_MANUAL_PAUSE,
    OPERATOR_MANUAL_RELEASE
}
