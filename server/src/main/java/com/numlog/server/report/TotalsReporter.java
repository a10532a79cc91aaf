package com.numlog.server.report;

import com.numlog.common.LatencyStats;
import com.numlog.state.CounterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Logs the cumulative valid and unique counts, then the handler latency percentiles
 * for the interval. Resets nothing in {@link CounterState}.
 */
public final class TotalsReporter implements IntervalReporter {

    private static final Logger log = LoggerFactory.getLogger(TotalsReporter.class);

    private final CounterState state;
    private final Duration interval;
    private final LatencyStats latency;

    public TotalsReporter(CounterState state, Duration interval, LatencyStats latency) {
        this.state    = state;
        this.interval = interval;
        this.latency  = latency;
    }

    @Override
    public String name() { return "log"; }

    @Override
    public Duration interval() { return interval; }

    @Override
    public void emit() {
        log.info("Total valid numbers: {} (unique: {})", state.total(), state.uniqueCount());
        latency.logAndReset(log);
    }
}
