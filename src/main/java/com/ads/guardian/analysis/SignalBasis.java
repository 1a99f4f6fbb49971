package com.ads.guardian.analysis;

/**
 * How a profitability estimate was derived.
 */
public enum SignalBasis {
    /** Reported conversion value minus spend. */
    VALUE_BASED,
    /** Cost per conversion against the configured breakeven cost. */
    PROXY
}
