package com.ads.guardian.service;

import com.ads.guardian.action.BackoffPolicy;
import com.ads.guardian.action.Sleeper;
import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.persistence.ManagedEntityEntity;
import com.ads.guardian.platform.AdsPlatformClient;
import com.ads.guardian.platform.FetchException;
import com.ads.guardian.platform.FetchOutcome;
import com.ads.guardian.platform.MetricsSnapshot;
import com.ads.guardian.platform.ReportingWindow;
import com.ads.guardian.platform.TransientFetchException;
import com.google.common.util.concurrent.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Pulls metrics for all monitored entities, one batch per campaign, batches in parallel.
 * Transient failures are retried within the tick; a failure for one entity never blocks the others.
 */
@Service
@Slf4j
public class MetricsSnapshotFetcher {

    private final AdsPlatformClient platformClient;
    private final ExecutorService workerPool;
    private final Sleeper sleeper;
    private final RateLimiter rateLimiter;
    private final BackoffPolicy backoff;
    private final int maxRetries;

    public MetricsSnapshotFetcher(AdsPlatformClient platformClient,
                                  @Qualifier("guardianWorkerPool") ExecutorService workerPool,
                                  GuardianSettings settings,
                                  Sleeper sleeper) {
        this.platformClient = platformClient;
        this.workerPool = workerPool;
        this.sleeper = sleeper;
        this.rateLimiter = RateLimiter.create(settings.getFetchRequestsPerSecond());
        this.backoff = new BackoffPolicy(settings.getActionBackoffBaseMs(), settings.getActionBackoffMaxMs(), 0.0);
        this.maxRetries = settings.getFetchMaxRetries();
    }

    /**
     * @throws TickAbortedException when every entity failed
     */
    public FetchReport fetch(List<ManagedEntityEntity> entities, LocalDateTime tickTime) {
        Map<String, MetricsSnapshot> snapshots = new LinkedHashMap<>();
        Map<String, FetchException> failures = new LinkedHashMap<>();
        if (entities.isEmpty()) {
            return new FetchReport(tickTime, snapshots, failures);
        }

        Map<String, List<String>> byCampaign = new LinkedHashMap<>();
        for (ManagedEntityEntity entity : entities) {
            byCampaign.computeIfAbsent(entity.getCampaignId(), k -> new ArrayList<>()).add(entity.getEntityId());
        }

        ReportingWindow window = ReportingWindow.dayUntil(tickTime);
        List<List<String>> batches = new ArrayList<>(byCampaign.values());
        List<Callable<BatchResult>> tasks = new ArrayList<>();
        for (List<String> batch : batches) {
            tasks.add(() -> fetchBatch(batch, window, tickTime));
        }

        try {
            List<Future<BatchResult>> futures = workerPool.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                BatchResult result = collect(batches.get(i), futures.get(i));
                snapshots.putAll(result.snapshots);
                failures.putAll(result.failures);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TickAbortedException("Interrupted while fetching metrics", e);
        }

        log.info("Fetched metrics for {}/{} entities in {} batches ({} failed)",
                snapshots.size(), entities.size(), batches.size(), failures.size());

        FetchReport report = new FetchReport(tickTime, snapshots, failures);
        if (report.isAllFailed()) {
            throw new TickAbortedException("Metrics fetch failed for all " + failures.size() + " entities");
        }
        return report;
    }

    BatchResult fetchBatch(List<String> entityIds, ReportingWindow window, LocalDateTime tickTime) {
        BatchResult result = new BatchResult();
        List<String> pending = new ArrayList<>(entityIds);

        for (int attempt = 1; attempt <= maxRetries + 1 && !pending.isEmpty(); attempt++) {
            rateLimiter.acquire();
            Map<String, FetchOutcome> outcomes = callPlatform(pending, window);

            List<String> retry = new ArrayList<>();
            for (String entityId : pending) {
                FetchOutcome outcome = outcomes.get(entityId);
                if (outcome == null) {
                    outcome = FetchOutcome.failure(
                            new TransientFetchException(entityId, "No metrics returned for " + entityId));
                }

                if (outcome.isSuccess()) {
                    result.snapshots.put(entityId, normalize(outcome.getSnapshot(), entityId, tickTime));
                } else if (outcome.getError().isRetryable() && attempt <= maxRetries) {
                    retry.add(entityId);
                } else {
                    result.failures.put(entityId, outcome.getError());
                    log.warn("Metrics for {} unavailable after {} attempt(s): {}",
                            entityId, attempt, outcome.getError().getMessage());
                }
            }

            pending = retry;
            if (!pending.isEmpty()) {
                Duration delay = backoff.delayFor(attempt);
                log.info("Retrying metrics fetch for {} entities in {}ms (attempt {}/{})",
                        pending.size(), delay.toMillis(), attempt + 1, maxRetries + 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (String entityId : pending) {
                        result.failures.put(entityId, new TransientFetchException(entityId, "Interrupted"));
                    }
                    break;
                }
            }
        }
        return result;
    }

    private Map<String, FetchOutcome> callPlatform(List<String> entityIds, ReportingWindow window) {
        try {
            Map<String, FetchOutcome> outcomes = platformClient.fetchMetrics(entityIds, window);
            return outcomes != null ? outcomes : Map.of();
        } catch (RuntimeException e) {
            log.warn("Metrics request for {} entities failed: {}", entityIds.size(), e.getMessage());
            Map<String, FetchOutcome> failed = new LinkedHashMap<>();
            for (String entityId : entityIds) {
                failed.put(entityId, FetchOutcome.failure(
                        new TransientFetchException(entityId, "Metrics request failed: " + e.getMessage(), e)));
            }
            return failed;
        }
    }

    private BatchResult collect(List<String> batch, Future<BatchResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error fetching batch of {} entities: {}", batch.size(), cause.getMessage(), cause);
            BatchResult failed = new BatchResult();
            for (String entityId : batch) {
                failed.failures.put(entityId, new TransientFetchException(entityId, cause.getMessage(), cause));
            }
            return failed;
        }
    }

    /**
     * Pin the snapshot to the tick so history rows line up with tick times.
     */
    private static MetricsSnapshot normalize(MetricsSnapshot snapshot, String entityId, LocalDateTime tickTime) {
        return snapshot.toBuilder()
                .entityId(entityId)
                .tickTime(tickTime)
                .build();
    }

    static final class BatchResult {
        final Map<String, MetricsSnapshot> snapshots = new LinkedHashMap<>();
        final Map<String, FetchException> failures = new LinkedHashMap<>();
    }
}
