package com.numlog.common;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;
import org.slf4j.Logger;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe latency tracking using HdrHistogram.
 * Record nanos from any thread; report percentiles periodically from one thread.
 */
public final class LatencyStats {

    private final Recorder recorder;
    private final LongAdder count = new LongAdder();
    private final String name;

    private Histogram interval;

    public LatencyStats(String name) {
        this.name = name;
        // 3 sig figs, auto-resizing
        this.recorder = new Recorder(3);
    }

    public void record(long latencyNanos) {
        recorder.recordValue(Math.max(0, latencyNanos));
        count.increment();
    }

    /**
     * Logs percentiles recorded since the previous call, then starts a new interval.
     * Silent when nothing was recorded.
     */
    public void logAndReset(Logger log) {
        long total = count.sumThenReset();
        interval = interval == null
                ? recorder.getIntervalHistogram()
                : recorder.getIntervalHistogram(interval);
        if (total == 0) return;
        log.info("[metrics] {} count={} p50={}µs p99={}µs p999={}µs max={}µs",
                name, total,
                micros(interval.getValueAtPercentile(50)),
                micros(interval.getValueAtPercentile(99)),
                micros(interval.getValueAtPercentile(99.9)),
                micros(interval.getMaxValue()));
    }

    private static String micros(long nanos) {
        return String.format("%.1f", nanos / 1_000.0);
    }
}
