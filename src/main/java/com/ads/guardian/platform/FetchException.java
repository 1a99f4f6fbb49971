package com.ads.guardian.platform;

/**
 * Failure to fetch metrics for a single entity.
 */
public abstract class FetchException extends Exception {

    private final String entityId;

    protected FetchException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    protected FetchException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }

    public abstract boolean isRetryable();
}
