package com.ads.guardian.platform;

/**
 * Authorization or entity-not-found failure. Not retried within the tick.
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(String entityId, String message) {
        super(entityId, message);
    }

    public PermanentFetchException(String entityId, String message, Throwable cause) {
        super(entityId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
