package com.querypilot.generation;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket: {@code maxCalls} permits per {@code period}, refilled continuously.
 */
public class RateLimiter {

    private static final long MAX_POLL_NANOS = Duration.ofMillis(100).toNanos();

    private final double capacity;
    private final double permitsPerNano;
    private final LongSupplier nanoTime;

    private double tokens;
    private long lastRefill;

    public RateLimiter(int maxCalls, Duration period) {
        this(maxCalls, period, System::nanoTime);
    }

    RateLimiter(int maxCalls, Duration period, LongSupplier nanoTime) {
        if (maxCalls <= 0 || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Rate limit must allow at least one call per positive period");
        }
        this.capacity = maxCalls;
        this.permitsPerNano = maxCalls / (double) period.toNanos();
        this.nanoTime = nanoTime;
        this.tokens = maxCalls;
        this.lastRefill = nanoTime.getAsLong();
    }

    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0d) {
            tokens -= 1.0d;
            return true;
        }
        return false;
    }

    /**
     * Wait up to {@code timeout} for a permit.
     *
     * @return false when no permit became available in time
     */
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        long deadline = nanoTime.getAsLong() + timeout.toNanos();
        while (true) {
            long wait;
            synchronized (this) {
                refill();
                if (tokens >= 1.0d) {
                    tokens -= 1.0d;
                    return true;
                }
                wait = (long) Math.ceil((1.0d - tokens) / permitsPerNano);
            }
            long left = deadline - nanoTime.getAsLong();
            if (left <= 0) {
                return false;
            }
            Thread.sleep(Math.max(1, Math.min(Math.min(wait, left), MAX_POLL_NANOS) / 1_000_000));
        }
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * permitsPerNano);
            lastRefill = now;
        }
    }
}
