package com.numlog.server.report;

import java.time.Duration;

/**
 * A periodic view of the shared counters. {@link #emit()} is called once per tick and
 * once more at shutdown; it runs on a reporter scheduler thread.
 */
public interface IntervalReporter {

    String name();

    Duration interval();

    void emit();
}
