package com.numlog.protocol;

/**
 * Outcome of validating one line. {@code reason} is null for accepted lines;
 * {@code response} is the exact text to write back in both cases.
 */
public record ValidationResult(long value, MalformedReason reason, String response) {

    public static ValidationResult accepted(long value) {
        return new ValidationResult(value, null, LineProtocol.echo(value));
    }

    public static ValidationResult rejected(MalformedReason reason, String response) {
        return new ValidationResult(0L, reason, response);
    }

    public boolean isValid() { return reason == null; }
}
