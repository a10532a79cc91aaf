package com.numlog.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives internal faults that must stop the process: a failed unique-values append or a
 * broken line decoder. Client input errors never get here.
 */
@FunctionalInterface
public interface FatalFaultHandler {

    int EXIT_STATUS = 2;

    void onFatal(Throwable cause);

    /** Logs the fault and halts the JVM without running shutdown hooks. */
    static FatalFaultHandler halting() {
        Logger log = LoggerFactory.getLogger(FatalFaultHandler.class);
        return cause -> {
            log.error("Fatal internal fault, halting with status {}", EXIT_STATUS, cause);
            Runtime.getRuntime().halt(EXIT_STATUS);
        };
    }
}
