package com.numlog.server.report;

import com.numlog.state.CounterState;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Prints how many valid records arrived since the previous tick, resetting the interval count.
 */
public final class OutputReporter implements IntervalReporter {

    private final CounterState state;
    private final Duration interval;
    private final PrintStream out;

    public OutputReporter(CounterState state, Duration interval, PrintStream out) {
        this.state    = state;
        this.interval = interval;
        this.out      = out;
    }

    @Override
    public String name() { return "output"; }

    @Override
    public Duration interval() { return interval; }

    @Override
    public void emit() {
        long delta = state.snapshotAndResetInterval();
        out.printf("Received %d valid numbers in the last %ds.%n", delta, interval.toSeconds());
        out.flush();
    }
}
