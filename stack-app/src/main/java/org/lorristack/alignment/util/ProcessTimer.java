package org.lorristack.alignment.util;

/**
 * Tracks elapsed time for long running processes.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        return (totalMinutes / 60) + " hours, " + (totalMinutes % 60) + " minutes, " + (totalSeconds % 60) + " seconds";
    }
}
