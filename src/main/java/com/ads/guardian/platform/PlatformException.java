package com.ads.guardian.platform;

/**
 * Failure of a status update call on the ads platform.
 */
public class PlatformException extends RuntimeException {

    private final boolean transientFailure;

    public PlatformException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public PlatformException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
