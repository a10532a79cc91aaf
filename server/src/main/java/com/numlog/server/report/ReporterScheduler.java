package com.numlog.server.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each {@link IntervalReporter} on its own fixed-rate schedule.
 *
 * The pool is sized to the number of reporters, so a slow emission occupies one thread
 * while the other reporters still tick on time. No reporter is pinned to a thread. {@link #stop()} cancels the schedules and then emits each reporter
 * exactly once more.
 */
public final class ReporterScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReporterScheduler.class);

    private final List<IntervalReporter> reporters;
    private final ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> ticks = new ArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ReporterScheduler(List<IntervalReporter> reporters) {
        this.reporters = List.copyOf(reporters);
        AtomicInteger threadIds = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, this.reporters.size()), r -> {
            Thread t = new Thread(r, "interval-reporter-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        for (IntervalReporter reporter : reporters) {
            long periodMs = reporter.interval().toMillis();
            ticks.add(scheduler.scheduleAtFixedRate(() -> tick(reporter), periodMs, periodMs, TimeUnit.MILLISECONDS));
            log.info("Reporter '{}' scheduled every {} ms", reporter.name(), periodMs);
        }
    }

    /** Cancels the schedules, waits for running ticks, then emits every reporter once more. */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;

        ticks.forEach(f -> f.cancel(false));
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reporter tick still running after 5s, emitting final reports anyway");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for reporter ticks, emitting final reports anyway");
        }
        for (IntervalReporter reporter : reporters) {
            tick(reporter);
        }
    }

    @Override
    public void close() {
        stop();
    }

    private static void tick(IntervalReporter reporter) {
        // an exception would silently cancel the fixed-rate schedule
        try {
            reporter.emit();
        } catch (RuntimeException e) {
            log.error("Reporter '{}' failed", reporter.name(), e);
        }
    }
}
