package com.ads.guardian.service;

import com.ads.guardian.platform.FetchException;
import com.ads.guardian.platform.MetricsSnapshot;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Result of fetching metrics for all monitored entities in one tick.
 * Every requested entity is either in {@code snapshots} or in {@code failures}.
 */
public class FetchReport {

    private final LocalDateTime tickTime;
    private final Map<String, MetricsSnapshot> snapshots;
    private final Map<String, FetchException> failures;

    public FetchReport(LocalDateTime tickTime, Map<String, MetricsSnapshot> snapshots,
                       Map<String, FetchException> failures) {
        this.tickTime = tickTime;
        this.snapshots = Collections.unmodifiableMap(snapshots);
        this.failures = Collections.unmodifiableMap(failures);
    }

    public LocalDateTime getTickTime() {
        return tickTime;
    }

    public Map<String, MetricsSnapshot> getSnapshots() {
        return snapshots;
    }

    public Map<String, FetchException> getFailures() {
        return failures;
    }

    public Optional<MetricsSnapshot> snapshotOf(String entityId) {
        return Optional.ofNullable(snapshots.get(entityId));
    }

    /**
     * Permanent failure: the entity is skipped this tick.
     */
    public boolean isSkipped(String entityId) {
        FetchException error = failures.get(entityId);
        return error != null && !error.isRetryable();
    }

    public int requestedCount() {
        return snapshots.size() + failures.size();
    }

    public boolean isAllFailed() {
        return snapshots.isEmpty() && !failures.isEmpty();
    }
}
