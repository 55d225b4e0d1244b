package org.lorristack.client.request;

import java.io.IOException;
import java.net.UnknownHostException;

import org.apache.http.impl.client.StandardHttpRequestRetryHandler;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A retry handler that extends the standard one by waiting before retrying requests
 * that failed because the archive host could not be resolved.
 */
public class WaitingRetryHandler extends StandardHttpRequestRetryHandler {

    private final long waitMilliseconds;

    public WaitingRetryHandler() {
        this(5000);
    }

    public WaitingRetryHandler(final long waitMilliseconds) {
        this.waitMilliseconds = waitMilliseconds;
    }

    @Override
    public boolean retryRequest(final IOException exception,
                                final int executionCount,
                                final HttpContext context) {

        final boolean retry;

        // the standard handler never retries unresolved hosts, so those are handled here
        if (exception instanceof UnknownHostException) {
            retry = executionCount <= getRetryCount();
            if (retry) {
                LOG.info("retryRequest: waiting {}ms before retrying request that failed from UnknownHostException",
                         waitMilliseconds);
                try {
                    Thread.sleep(waitMilliseconds);
                } catch (final InterruptedException ie) {
                    LOG.warn("retryRequest: retry wait was interrupted", ie);
                    Thread.currentThread().interrupt();
                }
            }
        } else {
            retry = super.retryRequest(exception, executionCount, context);
        }

        return retry;
    }

    private static final Logger LOG = LoggerFactory.getLogger(WaitingRetryHandler.class);
}
