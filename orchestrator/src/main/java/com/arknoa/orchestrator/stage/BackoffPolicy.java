package com.arknoa.orchestrator.stage;

import java.time.Duration;

/**
 * Exponential backoff with jitter, declared per stage.
 *
 * delay(n) = min(cap, base * 2^(n-1)), then scaled into
 * [delay * (1 - jitter), delay] by the random draw.
 *
 * @param base   delay after the first failed attempt
 * @param cap    upper bound for any delay
 * @param jitter fraction of the delay that is randomised, 0.0 to 1.0
 */
public record BackoffPolicy(Duration base, Duration cap, double jitter) {

    public BackoffPolicy {
        if (base == null || base.isNegative()) {
            throw new ConfigurationException("backoff base must be >= 0");
        }
        if (cap == null || cap.compareTo(base) < 0) {
            throw new ConfigurationException("backoff cap must be >= base");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new ConfigurationException("backoff jitter must be within [0, 1], was " + jitter);
        }
    }

    public static BackoffPolicy fixed(Duration delay) {
        return new BackoffPolicy(delay, delay, 0.0);
    }

    /**
     * @param failedAttempts number of failed attempts so far (1 for the first retry)
     * @param random         uniform draw in [0, 1)
     */
    public Duration delayFor(int failedAttempts, double random) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        long baseMs  = base.toMillis();
        long capMs   = cap.toMillis();
        long raw     = baseMs > (capMs >> exponent) ? capMs : Math.min(capMs, baseMs << exponent);
        double scale = 1.0 - jitter + jitter * random;
        return Duration.ofMillis(Math.round(raw * scale));
    }
}
