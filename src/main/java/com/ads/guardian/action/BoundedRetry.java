package com.ads.guardian.action;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Runs a call up to 1 + maxRetries times. Only errors accepted by the retryable predicate
 * are retried; the result is returned as a value, never thrown.
 */
@Slf4j
public class BoundedRetry {

    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final DoubleSupplier unitRandom;

    public BoundedRetry(BackoffPolicy backoff, Sleeper sleeper, DoubleSupplier unitRandom) {
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.unitRandom = unitRandom;
    }

    public <T> RetryResult<T> execute(String operation, Callable<T> call, int maxRetries,
                                      Predicate<Exception> retryable) {
        int maxAttempts = maxRetries + 1;
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return RetryResult.success(call.call(), attempt);
            } catch (Exception e) {
                lastError = e;
                if (!retryable.test(e)) {
                    log.warn("{} failed with non-retryable error: {}", operation, e.getMessage());
                    return RetryResult.failure(e, attempt);
                }
                if (attempt == maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    return RetryResult.failure(e, attempt);
                }

                Duration delay = backoff.delayFor(attempt, unitRandom.getAsDouble());
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RetryResult.failure(e, attempt);
                }
            }
        }
        return RetryResult.failure(lastError, maxAttempts);
    }
}
