package com.questrail.streaming.digitizer.error;

/**
 * An analog trace carries more than one trace for the same channel number.
 * Only raised when strict channel checking is enabled.
 */
public final class DuplicateChannelException extends DigitizerCodecException
{
    private final long channel;

    public DuplicateChannelException(long channel) {
        super("Channel " + channel + " appears more than once in the analog trace");
        this.channel = channel;
    }

    public long channel() {
        return channel;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_CHANNEL;
    }
}
