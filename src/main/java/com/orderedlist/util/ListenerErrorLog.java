package com.orderedlist.util;

import org.apache.logging.log4j.Logger;

/**
 * Rate-limited error logging for listener failures.
 *
 * A listener that throws on every change would otherwise write one stack
 * trace per mutation. At most one entry is written per interval; the entries
 * suppressed in between are counted and reported with the next one.
 */
public class ListenerErrorLog {
    private final Logger logger;
    private final long minIntervalNanos;
    private long lastLogTime;
    private boolean logged;
    private int suppressed;

    public ListenerErrorLog(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /**
     * @return true if the failure was written, false if it was suppressed.
     */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        if (logged && now - lastLogTime < minIntervalNanos) {
            suppressed++;
            return false;
        }
        if (suppressed > 0) {
            logger.error("{} ({} similar failures suppressed)", message, suppressed, t);
        } else {
            logger.error(message, t);
        }
        logged = true;
        lastLogTime = now;
        suppressed = 0;
        return true;
    }

    /** Failures swallowed since the last written entry. */
    public int suppressed() {
        return suppressed;
    }
}
