package com.questrail.streaming.digitizer.error;

/**
 * Closed classification of codec failures.
 *
 * <p>Consumers use this to separate "this buffer is not mine" from "this
 * buffer claims to be mine but is malformed". Only {@link #BAD_IDENTIFIER}
 * belongs to the first group; every other kind is a data-integrity incident.</p>
 */
public enum ErrorKind
{
    BAD_IDENTIFIER(false),
    MISSING_REQUIRED_FIELD(true),
    LENGTH_MISMATCH(true),
    TRUNCATED_BUFFER(true),
    INVALID_FIELD_VALUE(true),
    ZERO_SAMPLE_RATE(true),
    DUPLICATE_CHANNEL(true);

    private final boolean dataIntegrityFailure;

    ErrorKind(boolean dataIntegrityFailure) {
        this.dataIntegrityFailure = dataIntegrityFailure;
    }

    /**
     * Returns true if a buffer failing with this kind should be surfaced as a
     * data-integrity incident rather than silently rerouted.
     */
    public boolean isDataIntegrityFailure() {
        return dataIntegrityFailure;
    }
}
