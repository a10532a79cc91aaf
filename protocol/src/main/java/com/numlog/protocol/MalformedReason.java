package com.numlog.protocol;

/**
 * Why a client line was refused. Checked in declaration order; the first failing check wins.
 */
public enum MalformedReason {
    /** Raw line length, terminator included, differs from the record length. */
    LENGTH,
    /** Line body is not a base-10 integer. */
    FORMAT,
    /** Parsed value is below the configured minimum. */
    RANGE
}
