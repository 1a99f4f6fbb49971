package com.ads.guardian.service;

public enum AlertSeverity {

    INFO, WARNING, CRITICAL;

    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }
}
