package com.ads.guardian.platform;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ads platform fake. Honors idempotency keys: a key seen before returns the original
 * acknowledgement flagged as duplicate and changes nothing.
 */
public class InMemoryAdsPlatform implements AdsPlatformClient {

    private final Map<String, MetricsSnapshot> metrics = new ConcurrentHashMap<>();
    private final Map<String, PlatformStatus> statuses = new ConcurrentHashMap<>();
    private final Map<String, StatusUpdateAck> acksByKey = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> effectiveChanges = new ConcurrentHashMap<>();
    private final Map<String, Deque<FetchException>> fetchFailures = new ConcurrentHashMap<>();
    private final Map<String, Deque<PlatformException>> statusFailures = new ConcurrentHashMap<>();
    private final Set<String> timeoutAfterApply = ConcurrentHashMap.newKeySet();
    private final AtomicInteger fetchCalls = new AtomicInteger();
    private final AtomicInteger statusCalls = new AtomicInteger();

    private volatile RuntimeException fetchOutage;

    public void reset() {
        metrics.clear();
        statuses.clear();
        acksByKey.clear();
        effectiveChanges.clear();
        fetchFailures.clear();
        statusFailures.clear();
        timeoutAfterApply.clear();
        fetchCalls.set(0);
        statusCalls.set(0);
        fetchOutage = null;
    }

    public void setMetrics(MetricsSnapshot snapshot) {
        metrics.put(snapshot.getEntityId(), snapshot);
    }

    public void removeMetrics(String entityId) {
        metrics.remove(entityId);
    }

    /**
     * Queue errors returned for the entity's next fetches, one per call.
     */
    public void failFetch(String entityId, FetchException... errors) {
        fetchFailures.computeIfAbsent(entityId, k -> new ArrayDeque<>()).addAll(Arrays.asList(errors));
    }

    public void failAllFetches(RuntimeException outage) {
        this.fetchOutage = outage;
    }

    /**
     * Queue errors thrown by the entity's next status updates before anything is applied.
     */
    public void failStatusUpdate(String entityId, PlatformException... errors) {
        statusFailures.computeIfAbsent(entityId, k -> new ArrayDeque<>()).addAll(Arrays.asList(errors));
    }

    /**
     * The next status update of the entity is applied, then the caller sees a timeout.
     */
    public void timeoutAfterApply(String entityId) {
        timeoutAfterApply.add(entityId);
    }

    public PlatformStatus statusOf(String entityId) {
        return statuses.getOrDefault(entityId, PlatformStatus.ENABLED);
    }

    public int effectiveChanges(String entityId) {
        AtomicInteger count = effectiveChanges.get(entityId);
        return count != null ? count.get() : 0;
    }

    public int getFetchCalls() {
        return fetchCalls.get();
    }

    public int getStatusCalls() {
        return statusCalls.get();
    }

    @Override
    public Map<String, FetchOutcome> fetchMetrics(Collection<String> entityIds, ReportingWindow window) {
        fetchCalls.incrementAndGet();
        if (fetchOutage != null) {
            throw fetchOutage;
        }

        Map<String, FetchOutcome> result = new LinkedHashMap<>();
        for (String entityId : entityIds) {
            Deque<FetchException> failures = fetchFailures.get(entityId);
            FetchException failure = failures != null ? failures.poll() : null;
            if (failure != null) {
                result.put(entityId, FetchOutcome.failure(failure));
                continue;
            }
            MetricsSnapshot snapshot = metrics.get(entityId);
            if (snapshot == null) {
                result.put(entityId, FetchOutcome.failure(
                        new PermanentFetchException(entityId, "NOT_FOUND: " + entityId)));
            } else {
                result.put(entityId, FetchOutcome.success(snapshot));
            }
        }
        return result;
    }

    @Override
    public synchronized StatusUpdateAck setEntityStatus(String entityId, PlatformStatus targetStatus,
                                                        String idempotencyKey) {
        statusCalls.incrementAndGet();

        Deque<PlatformException> failures = statusFailures.get(entityId);
        PlatformException failure = failures != null ? failures.poll() : null;
        if (failure != null) {
            throw failure;
        }

        StatusUpdateAck previous = acksByKey.get(idempotencyKey);
        if (previous != null) {
            return StatusUpdateAck.builder()
                    .entityId(previous.getEntityId())
                    .status(previous.getStatus())
                    .idempotencyKey(idempotencyKey)
                    .duplicate(true)
                    .acknowledgedAt(previous.getAcknowledgedAt())
                    .build();
        }

        statuses.put(entityId, targetStatus);
        effectiveChanges.computeIfAbsent(entityId, k -> new AtomicInteger()).incrementAndGet();
        StatusUpdateAck ack = StatusUpdateAck.builder()
                .entityId(entityId)
                .status(targetStatus)
                .idempotencyKey(idempotencyKey)
                .duplicate(false)
                .acknowledgedAt(LocalDateTime.now())
                .build();
        acksByKey.put(idempotencyKey, ack);

        if (timeoutAfterApply.remove(entityId)) {
            throw new PlatformException("Read timed out", true);
        }
        return ack;
    }
}
