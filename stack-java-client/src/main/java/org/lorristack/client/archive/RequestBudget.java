package org.lorristack.client.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limits the number of requests sent to the archive server and paces them.
 * Every request must be registered through {@link #acquire()} before it is sent.
 */
public class RequestBudget {

    public static final int DEFAULT_MAX_REQUESTS = 1000;
    public static final long DEFAULT_PAUSE_MILLISECONDS = 1000;

    private final int maxRequests;
    private final long pauseMilliseconds;
    private int requestCount;

    public RequestBudget() {
        this(DEFAULT_MAX_REQUESTS, DEFAULT_PAUSE_MILLISECONDS);
    }

    public RequestBudget(final int maxRequests,
                         final long pauseMilliseconds) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (pauseMilliseconds < 0) {
            throw new IllegalArgumentException("pauseMilliseconds must not be negative");
        }
        this.maxRequests = maxRequests;
        this.pauseMilliseconds = pauseMilliseconds;
        this.requestCount = 0;
    }

    /**
     * Counts one more request against this budget.
     *
     * @throws IllegalStateException
     *   if the budget has been exhausted.
     */
    public synchronized void acquire()
            throws IllegalStateException {
        if (requestCount >= maxRequests) {
            throw new IllegalStateException("too many HTTP requests attempted, maximum is " + maxRequests);
        }
        requestCount++;
    }

    /**
     * Waits between requests so the archive server is not flooded.
     */
    public void pause() {
        if (pauseMilliseconds > 0) {
            try {
                Thread.sleep(pauseMilliseconds);
            } catch (final InterruptedException ie) {
                LOG.warn("pause: wait was interrupted", ie);
                Thread.currentThread().interrupt();
            }
        }
    }

    public synchronized int getRequestCount() {
        return requestCount;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RequestBudget.class);
}
