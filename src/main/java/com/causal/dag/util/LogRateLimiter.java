package com.causal.dag.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of INFO logging from tight search loops.
 * Progress of a long enumeration is logged at most once per interval; the
 * remaining messages are dropped.
 */
public class LogRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(0);

    public LogRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs the message at INFO if the interval since the last logged message
     * has elapsed.
     *
     * @return true if the message was logged.
     */
    public boolean info(String message, Object... params) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == 0 || now - last > minIntervalNanos) {
            // Only one caller wins the slot when several race for it
            if (lastLogTime.compareAndSet(last, now)) {
                logger.info(message, params);
                return true;
            }
        }
        return false;
    }
}
