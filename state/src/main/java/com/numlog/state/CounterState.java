package com.numlog.state;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared state for every connection handler and both interval reporters.
 *
 * Admission gate: a {@link Semaphore} of {@code capacity} permits, acquired without
 * blocking and released exactly once per acquire. Once closed, no permits are granted.
 *
 * Dedup set and running totals: guarded together by this object's monitor so that
 * totals, set and unique-values log never disagree. Low contention: every critical
 * section is an in-memory update plus, for a first-seen value, one flushed file append.
 * No socket I/O happens under the lock.
 */
public final class CounterState {

    private static final Logger log = LoggerFactory.getLogger(CounterState.class);

    private final int capacity;
    private final Semaphore permits;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final LongOpenHashSet seen = new LongOpenHashSet();
    private final UniqueValueLog uniqueLog;

    // Guarded by this
    private long totalValid;
    private long intervalValid;

    public CounterState(int capacity, UniqueValueLog uniqueLog) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity  = capacity;
        this.permits   = new Semaphore(capacity);
        this.uniqueLog = uniqueLog;
    }

    // ---- Admission gate ----

    /** Reserves one slot without blocking. False when at capacity or closed. */
    public boolean tryAcquire() {
        if (closed.get()) return false;
        return permits.tryAcquire();
    }

    /**
     * Returns one slot. Must pair with exactly one successful {@link #tryAcquire()}.
     *
     * @throws IllegalStateException if no slot is outstanding
     */
    public void release() {
        if (permits.availablePermits() >= capacity) {
            throw new IllegalStateException("release() without a matching tryAcquire()");
        }
        permits.release();
    }

    public int inFlight() {
        return capacity - permits.availablePermits();
    }

    public int capacity() { return capacity; }

    // ---- Records ----

    /** Counts one well-formed record, duplicate or not. */
    public synchronized void recordValid(long value) {
        totalValid++;
        intervalValid++;
    }

    public synchronized boolean hasSeen(long value) {
        return seen.contains(value);
    }

    /**
     * Inserts {@code value} if absent and appends it to the unique-values log.
     *
     * @return true on first insertion, false if already present
     * @throws FatalFaultException if the log append fails
     */
    public synchronized boolean recordUnique(long value) {
        if (!seen.add(value)) return false;
        try {
            uniqueLog.append(value);
        } catch (IOException e) {
            throw new FatalFaultException("could not log unique value " + value, e);
        }
        return true;
    }

    // ---- Reporter views ----

    /** Reads and zeroes the count of valid records since the previous call. */
    public synchronized long snapshotAndResetInterval() {
        long delta = intervalValid;
        intervalValid = 0;
        return delta;
    }

    public synchronized long total() {
        return totalValid;
    }

    public synchronized long uniqueCount() {
        return seen.size();
    }

    // ---- Lifecycle ----

    /** Stops granting slots. Idempotent. */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Counter state closed with {} connection(s) in flight", inFlight());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Waits until every outstanding slot has been released.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (!permits.tryAcquire(capacity, timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        permits.release(capacity);
        return true;
    }
}
