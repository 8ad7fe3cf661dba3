package com.govmatrix.extract.http;

import com.govmatrix.extract.util.Ticker;

/**
 * Single shared request slot with an adaptive spacing delay.
 *
 * <p>Every caller reserves the next slot under the lock (read-check-update only) and then waits
 * for it outside the lock, so consecutive dispatches are never closer together than the delay in
 * effect when the earlier slot was reserved.
 */
public class AdaptiveRateLimiter {
    private final Object lock = new Object();
    private final Ticker ticker;
    private final long floorMs;
    private final long ceilingMs;
    private final double relaxFactor;
    private final double tightenFactor;

    private double currentDelayMs;
    private long nextAllowedAtMs;

    public AdaptiveRateLimiter(
        Ticker ticker,
        long floorMs,
        long ceilingMs,
        double relaxFactor,
        double tightenFactor
    ) {
        this.ticker = ticker;
        this.floorMs = Math.max(0, floorMs);
        this.ceilingMs = Math.max(this.floorMs, ceilingMs);
        this.relaxFactor = relaxFactor;
        this.tightenFactor = tightenFactor;
        this.currentDelayMs = this.floorMs;
        this.nextAllowedAtMs = Long.MIN_VALUE;
    }

    public long acquire() throws InterruptedException {
        long slot;
        synchronized (lock) {
            long now = ticker.nowMillis();
            slot = Math.max(now, nextAllowedAtMs);
            nextAllowedAtMs = slot + Math.round(currentDelayMs);
        }
        long waitMs = slot - ticker.nowMillis();
        if (waitMs > 0) {
            ticker.sleepMillis(waitMs);
        }
        return slot;
    }

    public void relax() {
        synchronized (lock) {
            currentDelayMs = Math.max(floorMs, currentDelayMs * relaxFactor);
        }
    }

    public void tighten() {
        synchronized (lock) {
            currentDelayMs = Math.min(ceilingMs, Math.max(1.0, currentDelayMs) * tightenFactor);
        }
    }

    public long currentDelayMs() {
        synchronized (lock) {
            return Math.round(currentDelayMs);
        }
    }
}
