package com.ads.guardian.action;

import com.ads.guardian.config.GuardianSettings;
import com.ads.guardian.platform.AdsPlatformClient;
import com.ads.guardian.platform.PlatformException;
import com.ads.guardian.platform.StatusUpdateAck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Applies status change intents on the ads platform.
 * Every retry of an intent reuses its idempotency key, so a call that timed out after the
 * platform applied it cannot take effect twice.
 */
@Component
@Slf4j
public class ActionApplier {

    private final AdsPlatformClient platformClient;
    private final ExecutorService workerPool;
    private final BoundedRetry retry;
    private final int maxRetries;

    public ActionApplier(AdsPlatformClient platformClient,
                         @Qualifier("guardianWorkerPool") ExecutorService workerPool,
                         GuardianSettings settings,
                         Sleeper sleeper) {
        this.platformClient = platformClient;
        this.workerPool = workerPool;
        this.maxRetries = settings.getActionMaxRetries();
        this.retry = new BoundedRetry(
                new BackoffPolicy(settings.getActionBackoffBaseMs(), settings.getActionBackoffMaxMs(),
                        settings.getBackoffJitterRatio()),
                sleeper,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Apply all intents concurrently. Returns one outcome per entity id.
     * Duplicate intents for the same entity are collapsed to the last one.
     */
    public Map<String, ApplyOutcome> applyAll(List<StatusChangeIntent> intents) {
        Map<String, StatusChangeIntent> byEntity = new LinkedHashMap<>();
        for (StatusChangeIntent intent : intents) {
            byEntity.put(intent.getEntityId(), intent);
        }

        Map<String, ApplyOutcome> outcomes = new LinkedHashMap<>();
        if (byEntity.isEmpty()) {
            return outcomes;
        }

        List<StatusChangeIntent> ordered = new ArrayList<>(byEntity.values());
        List<Callable<ApplyOutcome>> tasks = new ArrayList<>();
        for (StatusChangeIntent intent : ordered) {
            tasks.add(() -> apply(intent));
        }

        log.info("Applying {} status changes", tasks.size());

        try {
            List<Future<ApplyOutcome>> futures = workerPool.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                StatusChangeIntent intent = ordered.get(i);
                outcomes.put(intent.getEntityId(), collect(intent, futures.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while applying status changes");
            for (StatusChangeIntent intent : ordered) {
                outcomes.putIfAbsent(intent.getEntityId(), ApplyOutcome.failed(intent, 0, "Interrupted"));
            }
        }

        return outcomes;
    }

    /**
     * Apply one intent with bounded retry on transient platform errors.
     */
    public ApplyOutcome apply(StatusChangeIntent intent) {
        RetryResult<StatusUpdateAck> result = retry.execute(
                "Set " + intent.getEntityId() + " -> " + intent.getTargetStatus(),
                () -> platformClient.setEntityStatus(
                        intent.getEntityId(), intent.getTargetStatus(), intent.getIdempotencyKey()),
                maxRetries,
                ActionApplier::isTransient);

        if (result.isSuccess()) {
            StatusUpdateAck ack = result.getValue();
            log.info("Entity {} set to {} (key={}, attempts={}, duplicate={})",
                    intent.getEntityId(), intent.getTargetStatus(), intent.getIdempotencyKey(),
                    result.getAttempts(), ack != null && ack.isDuplicate());
            return ApplyOutcome.builder()
                    .intent(intent)
                    .status(ApplyStatus.APPLIED)
                    .attempts(result.getAttempts())
                    .ack(ack)
                    .build();
        }

        log.error("Failed to set entity {} to {} after {} attempts: {}",
                intent.getEntityId(), intent.getTargetStatus(), result.getAttempts(),
                result.getError().getMessage());
        return ApplyOutcome.failed(intent, result.getAttempts(), result.getError().getMessage());
    }

    private ApplyOutcome collect(StatusChangeIntent intent, Future<ApplyOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error applying intent for {}: {}", intent.getEntityId(), cause.getMessage(), cause);
            return ApplyOutcome.failed(intent, 0, cause.getMessage());
        }
    }

    private static boolean isTransient(Exception e) {
        return e instanceof PlatformException && ((PlatformException) e).isTransientFailure();
    }
}
