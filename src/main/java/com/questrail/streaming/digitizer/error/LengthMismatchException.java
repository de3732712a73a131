package com.questrail.streaming.digitizer.error;

/**
 * The parallel time, voltage and channel sequences of an event list do not
 * have the same length.
 */
public final class LengthMismatchException extends DigitizerCodecException
{
    private final int timeLength;
    private final int voltageLength;
    private final int channelLength;

    public LengthMismatchException(int timeLength, int voltageLength, int channelLength) {
        super("Event sequences must be the same length (time=" + timeLength
                + ", voltage=" + voltageLength
                + ", channel=" + channelLength + ")");
        this.timeLength = timeLength;
        this.voltageLength = voltageLength;
        this.channelLength = channelLength;
    }

    public int timeLength() {
        return timeLength;
    }

    public int voltageLength() {
        return voltageLength;
    }

    public int channelLength() {
        return channelLength;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.LENGTH_MISMATCH;
    }
}
