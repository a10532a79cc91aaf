package com.numlog.server.report;

import com.numlog.common.LatencyStats;
import com.numlog.state.CounterState;
import com.numlog.state.UniqueValueLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReporterSchedulerTest {

    private CounterState state;

    static final class CountingReporter implements IntervalReporter {
        final String name;
        final Duration interval;
        final AtomicInteger emits = new AtomicInteger();
        volatile boolean failNext;

        CountingReporter(String name, Duration interval) {
            this.name = name;
            this.interval = interval;
        }

        @Override public String name() { return name; }
        @Override public Duration interval() { return interval; }

        @Override
        public void emit() {
            emits.incrementAndGet();
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("boom");
            }
        }
    }

    @BeforeEach
    void setUp() {
        state = new CounterState(6, new UniqueValueLog() {
            @Override public void append(long value) {}
            @Override public void close() {}
        });
    }

    private static void awaitAtLeast(AtomicInteger counter, int n) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (counter.get() < n) {
            if (System.nanoTime() > deadline) fail("expected at least " + n + " emissions, saw " + counter.get());
            Thread.sleep(5);
        }
    }

    // -----------------------------------------------------------------------
    // Scheduling
    // -----------------------------------------------------------------------

    @Test
    void reportersTickIndependentlyAndEmitOnceMoreOnStop() throws Exception {
        CountingReporter fast = new CountingReporter("fast", Duration.ofMillis(20));
        CountingReporter slow = new CountingReporter("slow", Duration.ofHours(1));
        ReporterScheduler scheduler = new ReporterScheduler(List.of(fast, slow));

        scheduler.start();
        awaitAtLeast(fast.emits, 3);
        assertEquals(0, slow.emits.get(), "slow reporter has its own cadence");

        scheduler.stop();
        int fastAfterStop = fast.emits.get();
        assertEquals(1, slow.emits.get(), "final emission on stop");

        Thread.sleep(100);
        assertEquals(fastAfterStop, fast.emits.get(), "no ticks after stop");

        scheduler.stop();
        assertEquals(1, slow.emits.get(), "stop is idempotent");
    }

    @Test
    void failingEmissionDoesNotCancelSchedule() throws Exception {
        CountingReporter flaky = new CountingReporter("flaky", Duration.ofMillis(20));
        flaky.failNext = true;

        try (ReporterScheduler scheduler = new ReporterScheduler(List.of(flaky))) {
            scheduler.start();
            awaitAtLeast(flaky.emits, 3);
        }
    }

    // -----------------------------------------------------------------------
    // Concrete reporters
    // -----------------------------------------------------------------------

    @Test
    void outputReporterPrintsDeltaAndResetsInterval() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        OutputReporter reporter = new OutputReporter(state, Duration.ofSeconds(5), out);

        state.recordValid(1_000_001L);
        state.recordValid(1_000_002L);
        reporter.emit();
        reporter.emit();

        String printed = bytes.toString(StandardCharsets.UTF_8);
        assertEquals(String.format("Received 2 valid numbers in the last 5s.%n"
                + "Received 0 valid numbers in the last 5s.%n"), printed);
        assertEquals(2, state.total(), "total is untouched");
    }

    @Test
    void totalsReporterResetsNothing() {
        TotalsReporter reporter = new TotalsReporter(state, Duration.ofSeconds(10), new LatencyStats("test"));

        state.recordValid(1_000_001L);
        state.recordUnique(1_000_001L);
        reporter.emit();

        assertEquals(1, state.total());
        assertEquals(1, state.uniqueCount());
        assertEquals(1, state.snapshotAndResetInterval(), "interval count belongs to the output reporter");
    }
}
