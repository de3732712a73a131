package com.questrail.streaming.digitizer.error;

/**
 * The buffer is shorter than the region its declared shape requires, or one
 * of its offsets points outside the region a reader may legally visit.
 */
public final class TruncatedBufferException extends DigitizerCodecException
{
    public TruncatedBufferException(String region, long offset, long required, int available) {
        super("Buffer too short for " + region + ": needs " + required
                + " byte(s) at offset " + offset + " but buffer holds " + available);
    }

    public TruncatedBufferException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRUNCATED_BUFFER;
    }
}
