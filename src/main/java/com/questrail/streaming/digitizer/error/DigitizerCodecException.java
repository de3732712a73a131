package com.questrail.streaming.digitizer.error;

/**
 * Base type of every failure reported by the digitizer message codecs.
 *
 * <p>All codec failures are synchronous and unchecked. The codecs never retry,
 * pad, truncate or substitute defaults; a caller receiving one of these knows
 * the input was rejected as a whole.</p>
 */
public abstract class DigitizerCodecException extends RuntimeException
{
    protected DigitizerCodecException(String message) {
        super(message);
    }

    protected DigitizerCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the classification of this failure.
     */
    public abstract ErrorKind kind();

    /**
     * Shorthand for {@code kind().isDataIntegrityFailure()}.
     */
    public final boolean isDataIntegrityFailure() {
        return kind().isDataIntegrityFailure();
    }
}
