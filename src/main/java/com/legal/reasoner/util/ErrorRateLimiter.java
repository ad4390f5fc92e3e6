package com.legal.reasoner.util;

import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

/**
 * Throttles repetitive log lines, such as the same aggregation rejecting its
 * premises on every target of every step. At most one line is written per
 * interval; the lines dropped in between are counted and reported with the
 * next one that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final Level level;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, Level.ERROR, minIntervalMillis);
    }

    public ErrorRateLimiter(Logger logger, Level level, long minIntervalMillis) {
        this.logger = logger;
        this.level = level;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * Logs the message unless another line was logged within the interval.
     *
     * @return true if the line was written.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last != Long.MIN_VALUE && now - last <= minIntervalNanos) {
            suppressed.incrementAndGet();
            return false;
        }
        // Only one thread wins the interval
        if (!lastLogTime.compareAndSet(last, now)) {
            suppressed.incrementAndGet();
            return false;
        }
        long dropped = suppressed.getAndSet(0);
        if (dropped > 0)
            logger.log(level, message + " (" + dropped + " similar suppressed)", t);
        else
            logger.log(level, message, t);
        return true;
    }

    /** Lines dropped since the last one written. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
