package org.lorristack.client;

import org.lorristack.alignment.util.ProcessTimer;
import org.lorristack.client.archive.MissingImageException;
import org.lorristack.client.archive.NoMetadataFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs process completion and converts the outcome to an exit status.
 *
 * Configuration errors and missing local data stop a run with a one line error message.
 * Anything else is logged with its stack trace.
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting status.
     */
    public void run() {
        System.exit(runWithStatus());
    }

    /**
     * @return {@link #SUCCESS_STATUS} if the client completed, otherwise {@link #FAILURE_STATUS}.
     */
    public int runWithStatus() {

        LOG.info("runWithStatus: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status;
        try {
            runClient(args);
            LOG.info("runWithStatus: exit, processing completed in {}", processTimer);
            status = SUCCESS_STATUS;
        } catch (final IllegalArgumentException | MissingImageException | NoMetadataFileException e) {
            LOG.error("runWithStatus: {}", e.getMessage());
            LOG.info("runWithStatus: exit, processing stopped after {}", processTimer);
            status = FAILURE_STATUS;
        } catch (final Throwable t) {
            LOG.error("runWithStatus: caught exception", t);
            LOG.info("runWithStatus: exit, processing failed after {}", processTimer);
            status = FAILURE_STATUS;
        }

        return status;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
