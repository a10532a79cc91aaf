package com.numlog.state;

import java.io.Closeable;
import java.io.IOException;

/**
 * Durable record of values seen for the first time, in insertion order.
 * Called only while {@link CounterState} holds its lock, so implementations
 * need not be thread-safe.
 */
public interface UniqueValueLog extends Closeable {

    /** Appends one value; returns only once the value is handed to the OS. */
    void append(long value) throws IOException;
}
