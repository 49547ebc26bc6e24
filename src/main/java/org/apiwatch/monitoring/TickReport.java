package org.apiwatch.monitoring;

/**
 * Counters for one scheduler pass. {@code skipped} is set when another tick was still running.
 */
public record TickReport(boolean skipped, int due, int executed, int retired, int conflicts, int errors) {

    public static final TickReport SKIPPED = new TickReport(true, 0, 0, 0, 0, 0);
}
