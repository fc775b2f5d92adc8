package org.janelia.psf.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool wrapper that logs unexpected exceptions,
 * overall completion events and elapsed time.
 *
 * Absence of the standard exit log message indicates that the tool was terminated abnormally.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final String[] args;

    /**
     * @param  args  command line arguments for the tool.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the tool and exits the JVM with its status.
     */
    public void run() {
        System.exit(runWithStatus());
    }

    /**
     * Runs the tool with consistent log statements.
     *
     * @return {@link #SUCCESS_STATUS} or {@link #FAILURE_STATUS} if anything was thrown.
     */
    public int runWithStatus() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int status;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            status = SUCCESS_STATUS;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            status = FAILURE_STATUS;
        }

        return status;
    }

    /**
     * This method should contain the specific tool implementation to be wrapped.
     *
     * @param  args  command line arguments for the tool.
     *
     * @throws Exception
     *   if the tool fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
