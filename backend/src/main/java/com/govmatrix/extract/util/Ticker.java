package com.govmatrix.extract.util;

/**
 * Time source and sleeper used by everything that waits: the rate limiter, the client's
 * retry backoff and the paginator's stall backoff. Tests substitute a manual implementation.
 */
public interface Ticker {

    long nowMillis();

    void sleepMillis(long millis) throws InterruptedException;

    static Ticker system() {
        return SystemTicker.INSTANCE;
    }
}
