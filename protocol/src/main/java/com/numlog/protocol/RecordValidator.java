package com.numlog.protocol;

import com.numlog.common.NumlogConfig;

/**
 * Validates one raw client line: length first, then number format, then range.
 * Stateless and safe to share between connections.
 */
public final class RecordValidator {

    private final int recordLength;
    private final long minValue;

    public RecordValidator(int recordLength, long minValue) {
        this.recordLength = recordLength;
        this.minValue     = minValue;
    }

    public static RecordValidator from(NumlogConfig cfg) {
        return new RecordValidator(cfg.recordLength, cfg.minValue);
    }

    /**
     * @param rawLength byte length of the line as received, terminator included
     * @param line      the line text, or null when the line was too long to keep
     */
    public ValidationResult validate(int rawLength, String line) {
        if (rawLength != recordLength || line == null) {
            return ValidationResult.rejected(MalformedReason.LENGTH,
                    LineProtocol.lengthError(recordLength, rawLength));
        }

        long value;
        try {
            value = Long.parseLong(LineProtocol.body(line));
        } catch (NumberFormatException e) {
            return ValidationResult.rejected(MalformedReason.FORMAT, LineProtocol.formatError());
        }

        if (value < minValue) {
            return ValidationResult.rejected(MalformedReason.RANGE, LineProtocol.rangeError(minValue));
        }
        return ValidationResult.accepted(value);
    }
}
