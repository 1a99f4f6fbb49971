package com.ads.guardian.action;

import lombok.Getter;

import java.time.Duration;

/**
 * Exponential backoff as a pure delay computation: base * 2^(attempt-1), capped at max.
 * Jitter subtracts up to jitterRatio of the delay, driven by a caller-supplied unit random.
 */
@Getter
public class BackoffPolicy {

    private static final double MULTIPLIER = 2.0;

    private final long baseMs;
    private final long maxMs;
    private final double jitterRatio;

    public BackoffPolicy(long baseMs, long maxMs, double jitterRatio) {
        if (baseMs <= 0 || maxMs < baseMs) {
            throw new IllegalArgumentException("Invalid backoff bounds: base=" + baseMs + ", max=" + maxMs);
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("Jitter ratio must be in [0, 1): " + jitterRatio);
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitterRatio = jitterRatio;
    }

    /**
     * Delay after the given failed attempt (1-based), without jitter.
     */
    public Duration delayFor(int attempt) {
        return Duration.ofMillis(rawDelayMs(attempt));
    }

    /**
     * Delay after the given failed attempt with jitter.
     *
     * @param unitRandom value in [0, 1)
     */
    public Duration delayFor(int attempt, double unitRandom) {
        long raw = rawDelayMs(attempt);
        long jitter = (long) (raw * jitterRatio * unitRandom);
        return Duration.ofMillis(Math.max(1L, raw - jitter));
    }

    private long rawDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1: " + attempt);
        }
        double raw = baseMs * Math.pow(MULTIPLIER, attempt - 1);
        return raw >= maxMs ? maxMs : (long) raw;
    }
}
