package com.ads.guardian.platform;

/**
 * Either a snapshot or the fetch error for one entity.
 */
public final class FetchOutcome {

    private final MetricsSnapshot snapshot;
    private final FetchException error;

    private FetchOutcome(MetricsSnapshot snapshot, FetchException error) {
        this.snapshot = snapshot;
        this.error = error;
    }

    public static FetchOutcome success(MetricsSnapshot snapshot) {
        return new FetchOutcome(snapshot, null);
    }

    public static FetchOutcome failure(FetchException error) {
        return new FetchOutcome(null, error);
    }

    public boolean isSuccess() {
        return snapshot != null;
    }

    public MetricsSnapshot getSnapshot() {
        return snapshot;
    }

    public FetchException getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchOutcome[" + snapshot.getEntityId() + "]"
                : "FetchOutcome[error=" + error.getMessage() + "]";
    }
}
