package com.ads.guardian.action;

/**
 * Outcome of a bounded retry loop: the value, or the last error, plus attempts used.
 */
public final class RetryResult<T> {

    private final T value;
    private final Exception error;
    private final int attempts;

    private RetryResult(T value, Exception error, int attempts) {
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    public static <T> RetryResult<T> failure(Exception error, int attempts) {
        return new RetryResult<>(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public Exception getError() {
        return error;
    }

    public int getAttempts() {
        return attempts;
    }
}
