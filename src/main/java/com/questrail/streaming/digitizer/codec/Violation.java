package com.questrail.streaming.digitizer.codec;

import java.util.Objects;

/**
 * One structural problem found by a codec's {@code validate} operation.
 *
 * @param severity whether the problem prevents encoding
 * @param code     machine-readable classification
 * @param detail   human-readable description
 */
public record Violation(Severity severity, Code code, String detail)
{
    public enum Severity {
        WARNING,
        ERROR
    }

    public enum Code {
        LENGTH_MISMATCH,
        ZERO_SAMPLE_RATE,
        DUPLICATE_CHANNEL
    }

    public Violation {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(detail, "detail");
    }

    public static Violation error(Code code, String detail) {
        return new Violation(Severity.ERROR, code, detail);
    }

    public static Violation warning(Code code, String detail) {
        return new Violation(Severity.WARNING, code, detail);
    }
}
