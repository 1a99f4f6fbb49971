package com.ads.guardian.platform;

/**
 * Rate limit or network failure. Retryable within the tick.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String entityId, String message) {
        super(entityId, message);
    }

    public TransientFetchException(String entityId, String message, Throwable cause) {
        super(entityId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
