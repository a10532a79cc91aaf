package com.numlog.protocol;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Text line protocol.
 *
 * Request:  one line of exactly {@code recordLength} bytes, terminator included,
 *           e.g. "123456789\n" for the default length of 10.
 * Response: the parsed number followed by '\n', or one of the ERR lines below.
 * Busy:     {@link #BUSY_MESSAGE} with no terminator, then the server closes.
 *
 * One byte is one character on this wire; lines are decoded as ISO-8859-1 so that
 * character counts and byte counts agree.
 */
public final class LineProtocol {

    public static final byte TERMINATOR = '\n';
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    public static final String BUSY_MESSAGE = "Server busy.";

    private static final String ERR_PREFIX = "ERR Malformed Request: ";

    private LineProtocol() {}

    public static String lengthError(int expected, int actual) {
        return ERR_PREFIX + "expected length " + expected + ", got " + actual + ".\n";
    }

    public static String formatError() {
        return ERR_PREFIX + "expected number\n";
    }

    public static String rangeError(long minValue) {
        return ERR_PREFIX + "expected number greater than " + minValue + "\n";
    }

    public static String echo(long value) {
        return value + "\n";
    }

    /** Strips one trailing terminator, if present. */
    public static String body(String line) {
        int n = line.length();
        return n > 0 && line.charAt(n - 1) == TERMINATOR ? line.substring(0, n - 1) : line;
    }
}
