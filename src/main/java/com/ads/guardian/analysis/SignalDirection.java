package com.ads.guardian.analysis;

public enum SignalDirection {
    POSITIVE, NEUTRAL, NEGATIVE
}
