package com.boardgame.gamegraph.client;

import com.boardgame.gamegraph.config.BggProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;

/**
 * Enforces a minimum gap between consecutive BGG requests.
 * One instance is shared by every caller; slot reservation is serialized so
 * concurrent callers can never dispatch closer together than the configured delay.
 */
@Component
@Slf4j
public class BggRateLimiter {

    private final long delayMillis;
    private long lastDispatchMillis = 0;

    @Autowired
    public BggRateLimiter(BggProperties properties) {
        this(properties.getRequestDelayMillis());
    }

    BggRateLimiter(long delayMillis) {
        this.delayMillis = Math.max(0, delayMillis);
    }

    /**
     * Block until the next request may be dispatched.
     *
     * @throws InterruptedIOException if the waiting thread is interrupted
     */
    public synchronized void acquire() throws InterruptedIOException {
        long now = System.currentTimeMillis();
        long timeSinceLastRequest = now - lastDispatchMillis;

        if (timeSinceLastRequest < delayMillis) {
            long sleepTime = delayMillis - timeSinceLastRequest;
            log.debug("Rate limiting: sleeping for {}ms", sleepTime);
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for rate limiter");
            }
        }

        lastDispatchMillis = System.currentTimeMillis();
    }

    public long getDelayMillis() {
        return delayMillis;
    }
}
