package org.janelia.psf.client;

import java.util.concurrent.TimeUnit;

/**
 * Elapsed wall clock time since construction, formatted for log messages.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    private final long startNanos;

    public ProcessTimer() {
        this.startNanos = System.nanoTime();
    }

    public long getElapsedMilliseconds() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * @return elapsed time like "2 minutes, 7.031 seconds".
     */
    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        final long minutes = TimeUnit.MILLISECONDS.toMinutes(elapsed);
        final double seconds = (elapsed - TimeUnit.MINUTES.toMillis(minutes)) / 1000.0;
        return String.format("%d minutes, %.3f seconds", minutes, seconds);
    }
}
