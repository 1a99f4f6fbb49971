package com.ads.guardian.platform;

/**
 * Serving status of an entity on the ads platform.
 */
public enum PlatformStatus {
    ENABLED, PAUSED
}
